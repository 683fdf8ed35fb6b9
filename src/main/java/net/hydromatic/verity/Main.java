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
package net.hydromatic.verity;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.verity.exec.CertifyResult;
import net.hydromatic.verity.exec.ParallelCertifier;
import net.hydromatic.verity.exec.Prop;
import net.hydromatic.verity.kernel.Declaration;
import net.hydromatic.verity.kernel.Environment;
import net.hydromatic.verity.kernel.Tracer;
import net.hydromatic.verity.kernel.Tracers;
import net.hydromatic.verity.kernel.Verdict;
import net.hydromatic.verity.parse.ExportParseException;
import net.hydromatic.verity.parse.ExportParser;
import net.hydromatic.verity.util.StackGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command-line checker for export files.
 *
 * <p>Usage: {@code verity [--name=value]... file...}, where each
 * {@code name} is a {@link Prop}. Each file is certified in a fresh
 * environment. */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private final ImmutableList<String> files;
  private final PrintWriter out;
  private final Map<Prop, Object> propMap;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    int status;
    try {
      final Main main =
          new Main(ImmutableList.copyOf(args),
              new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
              propMap);
      status = main.run();
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      status = 2;
    } catch (Throwable e) {
      e.printStackTrace();
      status = 2;
    }
    System.exit(status);
  }

  /** Creates a Main.
   *
   * @param argList Arguments: properties of the form {@code --name=value},
   *     then file names
   * @param out Writer for results
   * @param propMap Property values; arguments are added to it
   */
  public Main(List<String> argList, Writer out, Map<Prop, Object> propMap) {
    this.out =
        out instanceof PrintWriter ? (PrintWriter) out : new PrintWriter(out);
    this.propMap = propMap;
    final List<String> fileList = new ArrayList<>();
    for (String arg : argList) {
      if (arg.startsWith("--")) {
        final int eq = arg.indexOf('=');
        if (eq < 0) {
          throw new IllegalArgumentException("expected --name=value, got "
              + arg);
        }
        Prop.lookup(arg.substring(2, eq))
            .setLenient(propMap, arg.substring(eq + 1));
      } else {
        fileList.add(arg);
      }
    }
    if (fileList.isEmpty()) {
      throw new IllegalArgumentException(
          "usage: verity [--name=value]... file...");
    }
    this.files = ImmutableList.copyOf(fileList);
  }

  /** Certifies each file, and returns the exit status: 0 if every file was
   * certified, 1 otherwise. */
  public int run() {
    StackGuard.install(Prop.stackGuard(propMap));
    int status = 0;
    for (String file : files) {
      if (!run(Paths.get(file))) {
        status = 1;
      }
    }
    out.flush();
    return status;
  }

  private boolean run(Path path) {
    final List<Declaration> declarations;
    try (BufferedReader reader =
             Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      declarations = ExportParser.parse(reader);
    } catch (IOException | ExportParseException e) {
      LOGGER.debug("could not read {}", path, e);
      out.println(path + ": " + e.getMessage());
      return false;
    }
    LOGGER.info("read {} declarations from {}", declarations.size(), path);

    Tracer tracer = Tracers.empty();
    if (Prop.PRINT_VERDICTS.booleanValue(propMap)) {
      tracer =
          Tracers.withOnCommit(tracer, declaration -> {
            synchronized (out) {
              out.println("committed " + declaration.name);
            }
          });
    }
    final CertifyResult result =
        new ParallelCertifier(Environment.empty(), tracer, propMap)
            .certify(declarations);
    out.println(path + ": " + result);
    final Verdict rejection = result.rejection();
    if (rejection != null && rejection.error != null) {
      out.println(rejection.error.describeTo(new StringBuilder()));
    }
    return result.isSuccess();
  }
}

// End Main.java
