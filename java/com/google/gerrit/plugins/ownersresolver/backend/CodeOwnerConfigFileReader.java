// Copyright (C) 2026 The Android Open Source Project
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
// limitations under the License.

package com.google.gerrit.plugins.ownersresolver.backend;

import java.io.IOException;
import java.util.Optional;

/** Reads files of the repository for which code owners are resolved. */
public interface CodeOwnerConfigFileReader {
  /**
   * Reads a file.
   *
   * @param filePath path of the file relative to the repository root
   * @return the content of the file, {@link Optional#empty()} if the file doesn't exist
   * @throws IOException thrown if the file exists but cannot be read
   */
  Optional<String> read(String filePath) throws IOException;
}
