package me.golemcore.conductor.adapter.outbound.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Capture stream for the sandbox's stdout/stderr. Bytes past the cap are
 * dropped and the rendered text ends with a truncation marker.
 */
class BoundedOutput extends OutputStream {

    private final int maxChars;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private boolean truncated;

    BoundedOutput(int maxChars) {
        this.maxChars = maxChars;
    }

    @Override
    public synchronized void write(int b) {
        if (buffer.size() >= maxChars) {
            truncated = true;
            return;
        }
        buffer.write(b);
    }

    @Override
    public synchronized void write(byte[] bytes, int off, int len) {
        int room = maxChars - buffer.size();
        if (room <= 0) {
            truncated = true;
            return;
        }
        if (len > room) {
            truncated = true;
            len = room;
        }
        buffer.write(bytes, off, len);
    }

    synchronized String render() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        if (text.length() > maxChars) {
            text = text.substring(0, maxChars);
            truncated = true;
        }
        if (truncated) {
            return text + "\n\n[Output truncated at " + maxChars + " characters]";
        }
        return text;
    }
}
