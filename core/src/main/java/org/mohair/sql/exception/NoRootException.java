/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

public class NoRootException extends MalformedPlanException {

  public NoRootException(String message) {
    super(message);
  }
}
