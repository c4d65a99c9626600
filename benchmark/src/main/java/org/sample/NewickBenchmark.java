package org.sample;

import io.github.simbo1905.newick.Node;
import io.github.simbo1905.newick.Phylo;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/// Parse, write and prune a balanced tree with a few hundred tips
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class NewickBenchmark {

  @Param({"64", "512"})
  public int tips;

  private String newick;
  private Node root;
  private List<String> everyOtherTip;

  @Setup(Level.Trial)
  public void setupTrial() {
    newick = Phylo.newickize(balancedTree(0, tips - 1));
    root = Phylo.parseNewick(newick);
    final List<String> names = Phylo.extractTipNames(newick);
    everyOtherTip = new ArrayList<>();
    for (int i = 0; i < names.size(); i += 2) {
      everyOtherTip.add(names.get(i));
    }
    System.out.println("NewickBenchmark tree of " + tips + " tips is " + newick.length() + " characters");
  }

  /// Builds the tree bottom-up, halving the range of tip numbers at each level
  static Node balancedTree(int start, int end) {
    if (start == end) {
      return Node.tip("taxon_" + start, "0.01");
    }
    final int mid = (start + end) / 2;
    return Node.inner("n" + start + "_" + end, "0.1", List.of(balancedTree(start, mid), balancedTree(mid + 1, end)));
  }

  @Benchmark
  public void parse(Blackhole bh) {
    bh.consume(Phylo.parseNewick(newick));
  }

  @Benchmark
  public void newickize(Blackhole bh) {
    bh.consume(Phylo.newickize(root));
  }

  @Benchmark
  public void extractNames(Blackhole bh) {
    bh.consume(Phylo.extractNames(newick));
  }

  @Benchmark
  public void selectTips(Blackhole bh) {
    bh.consume(Phylo.selectTips(newick, everyOtherTip));
  }
}
