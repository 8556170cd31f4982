/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.cst2d.common.exceptions;

/**
 * Token text or kind that the builder cannot record, e.g. text
 * content with an embedded line break.
 */
public class InvalidTokenTextException extends CSTRuntimeError {

  public InvalidTokenTextException(String msg) {
    super(msg);
  }

  public InvalidTokenTextException(String file, int line, int col,
                                   String msg) {
    this(file, line, col, msg, null);
  }

  /**
   * Error at a source position, caused by an error found without it
   */
  public InvalidTokenTextException(String file, int line, int col,
                                   String msg, Throwable cause) {
    super(file + ":" + line + ":" + (col >= 0 ? (col + 1) + ":" : "") +
          " " + msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
