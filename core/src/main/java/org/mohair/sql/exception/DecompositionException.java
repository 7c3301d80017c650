/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

/**
 * Base class for failures raised while decoding, decomposing or re-encoding a query plan.
 */
public class DecompositionException extends RuntimeException {

  public DecompositionException(String message) {
    super(message);
  }

  public DecompositionException(String message, Throwable cause) {
    super(message, cause);
  }
}
