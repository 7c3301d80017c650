/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

/** A requested sub-plan that cannot be built, such as one that delegates the whole plan. */
public class InvalidSubplanException extends DecompositionException {

  public InvalidSubplanException(String message) {
    super(message);
  }
}
