// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.newick;

import java.util.List;
import java.util.NoSuchElementException;

/// Thrown when a clade label, tip label or clade identifier that a caller asked for is not present.
public class NewickNotFoundException extends NoSuchElementException {

  private final List<String> labels;

  public NewickNotFoundException(String message, List<String> labels) {
    super(message + ": " + String.join(", ", labels));
    this.labels = List.copyOf(labels);
  }

  /// The labels that could not be found
  public List<String> labels() {
    return labels;
  }
}
