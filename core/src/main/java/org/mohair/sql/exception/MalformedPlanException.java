/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

/**
 * A plan that parses but is not a valid operator tree, e.g. a relation whose type is unset or an
 * operator missing a required input.
 */
public class MalformedPlanException extends DecompositionException {

  public MalformedPlanException(String message) {
    super(message);
  }

  public MalformedPlanException(String message, Throwable cause) {
    super(message, cause);
  }
}
