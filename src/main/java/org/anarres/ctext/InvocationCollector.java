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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * An {@link InvocationListener} which records every invocation it is given.
 */
public class InvocationCollector implements InvocationListener {

    private final List<Invocation> invocations = new ArrayList<Invocation>();

    @Override
    public void handleInvocation(@Nonnull Invocation invocation) {
        invocations.add(invocation);
    }

    @Nonnull
    public List<Invocation> getInvocations() {
        return Collections.unmodifiableList(invocations);
    }

    public int size() {
        return invocations.size();
    }

    public void clear() {
        invocations.clear();
    }
}
