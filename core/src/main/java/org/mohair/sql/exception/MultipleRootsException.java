/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

public class MultipleRootsException extends MalformedPlanException {

  public MultipleRootsException(String message) {
    super(message);
  }
}
