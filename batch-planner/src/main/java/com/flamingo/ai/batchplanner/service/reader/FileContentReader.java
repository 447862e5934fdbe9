package com.flamingo.ai.batchplanner.service.reader;

import java.io.IOException;

/** Reads the content of a planned file. Only large files are read during planning. */
@FunctionalInterface
public interface FileContentReader {

  /**
   * Reads the full content of a file.
   *
   * @param path file path as given in the planner input
   * @return file content
   * @throws IOException if the file cannot be read or decoded
   */
  String read(String path) throws IOException;
}
