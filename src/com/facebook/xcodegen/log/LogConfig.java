/*
 * Copyright (c) Facebook, Inc. and its affiliates.
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

package com.facebook.xcodegen.log;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import com.google.common.io.Resources;
import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;
import java.net.URL;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.LogManager;
import org.stringtemplate.v4.ST;

/**
 * Configures {@link LogManager} for a generator run.
 *
 * <p>The bundled {@code logging.properties.st} template is rendered first, then an optional user
 * supplied properties file is appended so its entries override the defaults.
 */
public class LogConfig {

  private static final byte[] NEWLINE = {'\n'};
  private static final String TEMPLATE_RESOURCE = "logging.properties.st";

  private LogConfig() {}

  public static synchronized void setupLogging(Level consoleLevel, Optional<Path> userProperties)
      throws IOException {
    ImmutableList.Builder<InputStream> inputStreamsBuilder = ImmutableList.builder();
    inputStreamsBuilder.add(
        new ByteArrayInputStream(renderTemplate(consoleLevel).getBytes(Charsets.UTF_8)));
    inputStreamsBuilder.add(new ByteArrayInputStream(NEWLINE));

    if (userProperties.isPresent()
        && !addInputStreamForPath(userProperties.get(), inputStreamsBuilder)) {
      System.err.format(
          "Error: Couldn't open logging properties file %s\n", userProperties.get());
    }

    try (InputStream is =
        new SequenceInputStream(Iterators.asEnumeration(inputStreamsBuilder.build().iterator()))) {
      LogManager.getLogManager().readConfiguration(is);
    }
  }

  static String renderTemplate(Level consoleLevel) throws IOException {
    URL url = Resources.getResource(LogConfig.class, TEMPLATE_RESOURCE);
    ST st = new ST(Resources.toString(url, Charsets.UTF_8));
    st.add("default_level", Level.INFO.getName());
    st.add("console_level", consoleLevel.getName());
    return st.render();
  }

  private static boolean addInputStreamForPath(
      Path path, ImmutableList.Builder<InputStream> inputStreamsBuilder) {
    try {
      inputStreamsBuilder.add(new FileInputStream(path.toString()));
      // Handle the case where a file doesn't end with a newline.
      inputStreamsBuilder.add(new ByteArrayInputStream(NEWLINE));
      return true;
    } catch (FileNotFoundException e) {
      return false;
    }
  }
}
