/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

public class PlanSerializationException extends DecompositionException {

  public PlanSerializationException(String message) {
    super(message);
  }

  public PlanSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
