/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

/**
 * The plan is valid but contains no pipeline breaker, so there is no operator to retain while its
 * inputs are delegated.
 */
public class NoSplitPointException extends DecompositionException {

  public NoSplitPointException(String message) {
    super(message);
  }
}
