/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.gentzen.util;

/**
 * Exception raised by the proof engine.
 *
 * <p>Implementations are unchecked exceptions; this interface lets callers
 * describe any of them uniformly.
 */
public interface GentzenException {
  /** Appends a description of this exception to a buffer. */
  StringBuilder describeTo(StringBuilder buf);

  /** Returns the exception as a {@link Throwable}. */
  default Throwable asThrowable() {
    return (Throwable) this;
  }
}

// End GentzenException.java
