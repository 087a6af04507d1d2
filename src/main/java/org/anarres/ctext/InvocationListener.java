/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.ctext;

import javax.annotation.Nonnull;

/**
 * A handler for the invocations found by an {@link InvocationScanner}.
 */
@FunctionalInterface
public interface InvocationListener {

    /**
     * Called once per invocation, in source order, when its
     * terminating semicolon has been read.
     */
    void handleInvocation(@Nonnull Invocation invocation);
}
