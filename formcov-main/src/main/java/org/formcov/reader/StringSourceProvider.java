/*
 * Copyright (C) 2007-2010 Julio Vilmar Gesser.
 * Copyright (C) 2011, 2013-2016 The JavaParser Team.
 * Copyright 2019 Red Hat, Inc. and/or its affiliates.
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
 * limitations under the License.
 */
package org.formcov.reader;

import java.io.IOException;

/**
 * {@link SourceProvider} that reads module text held in a {@link String}.
 */
public class StringSourceProvider implements SourceProvider {

    private String text;
    private final String sourceName;
    private int position = 0;
    private final int size;

    public StringSourceProvider(String text) {
        this(text, "<string>");
    }

    public StringSourceProvider(String text, String sourceName) {
        this.text = text;
        this.sourceName = sourceName;
        this.size = text.length();
    }

    @Override
    public int read(char[] cbuf, int off, int len) throws IOException {
        if (text == null) {
            throw new IOException("Source " + sourceName + " is closed");
        }
        int outstanding = size - position;
        if (outstanding == 0) {
            return -1;
        }
        int count = Math.min(Math.min(cbuf.length - off, len), outstanding);
        text.getChars(position, position + count, cbuf, off);
        position += count;
        return count;
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    @Override
    public void close() {
        text = null;
    }
}
