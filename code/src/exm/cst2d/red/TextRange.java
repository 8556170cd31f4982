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
package exm.cst2d.red;

/**
 * Half-open range [start, end) of offsets into the literal text of a
 * tree.  Offsets are String indices.
 */
public class TextRange {
  public final int start;
  public final int end;

  public TextRange(int start, int end) {
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid range " + start + ".." + end);
    }
    this.start = start;
    this.end = end;
  }

  public static TextRange at(int offset, int length) {
    return new TextRange(offset, offset + length);
  }

  public int length() {
    return end - start;
  }

  public boolean isEmpty() {
    return start == end;
  }

  public boolean contains(int offset) {
    return start <= offset && offset < end;
  }

  @Override
  public int hashCode() {
    return 31 * start + end;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TextRange))
      return false;
    TextRange other = (TextRange) obj;
    return start == other.start && end == other.end;
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
