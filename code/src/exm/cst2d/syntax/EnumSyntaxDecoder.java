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
package exm.cst2d.syntax;

import java.util.HashMap;
import java.util.Map;

import exm.cst2d.common.exceptions.CSTRuntimeError;

/**
 * Decoder for an enum of syntax kinds, looking up constants by
 * their raw value.
 */
public class EnumSyntaxDecoder<E extends Enum<E> & Syntax>
                                implements SyntaxDecoder<E> {

  private final Class<E> kindClass;
  private final Map<Integer, E> byRaw = new HashMap<Integer, E>();

  public EnumSyntaxDecoder(Class<E> kindClass) {
    this.kindClass = kindClass;
    for (E kind: kindClass.getEnumConstants()) {
      E prev = byRaw.put(kind.toRaw(), kind);
      if (prev != null) {
        throw new CSTRuntimeError("Kinds " + prev + " and " + kind +
                          " of " + kindClass.getName() +
                          " share raw value " + kind.toRaw());
      }
    }
  }

  public static <E extends Enum<E> & Syntax> EnumSyntaxDecoder<E>
                                          create(Class<E> kindClass) {
    return new EnumSyntaxDecoder<E>(kindClass);
  }

  @Override
  public E fromRaw(int raw) {
    E kind = byRaw.get(raw);
    if (kind == null) {
      throw new CSTRuntimeError("Invalid raw syntax kind for " +
              kindClass.getSimpleName() + ": " + Integer.toUnsignedString(raw));
    }
    return kind;
  }
}
