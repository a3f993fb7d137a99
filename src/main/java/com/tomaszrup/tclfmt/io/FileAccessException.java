////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.tclfmt.io;

import java.nio.file.Path;

/**
 * Raised when a file cannot be read or written. Syntax problems in a script
 * are reported as diagnostics, never with this exception.
 */
public class FileAccessException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient Path path;

    public FileAccessException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public FileAccessException(String message, Path path) {
        super(message);
        this.path = path;
    }

    /**
     * The file that could not be accessed.
     */
    public Path getPath() {
        return path;
    }
}
