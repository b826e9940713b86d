/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.validation.table;

import org.apache.calcite.util.Source;

import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Table backed by a CSV or TSV file.
 *
 * <p>Every iteration opens a new reader, so the file is re-read from the
 * start on each pass. The first line is the header. Values are strings
 * exactly as read; no type conversion is done. Files whose path ends in
 * {@code .tsv} are read with a tab separator.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RowTable table = new CsvRowTable(Sources.of(new File("orders.csv")));
 * ProblemsView problems = table.validate(constraints, null);
 * }</pre>
 */
public class CsvRowTable implements RowTable {
  private static final Logger LOGGER = LoggerFactory.getLogger(CsvRowTable.class);

  private final Source source;

  public CsvRowTable(Source source) {
    this.source = source;
  }

  /** Returns the file this table reads. */
  public Source getSource() {
    return source;
  }

  @Override public Iterator<List<?>> iterator() {
    try {
      LOGGER.debug("Opening CSV source {}", source.path());
      return new RowIterator(openCsv(source));
    } catch (IOException e) {
      throw new UncheckedIOException("Error opening CSV file " + source.path(), e);
    }
  }

  @Override public String toString() {
    return "CsvRowTable{" + source.path() + "}";
  }

  /**
   * Opens a CSV reader, handling TSV files.
   */
  private static CSVReader openCsv(Source source) throws IOException {
    if (source.path().endsWith(".tsv")) {
      CSVParserBuilder parserBuilder = new CSVParserBuilder()
          .withSeparator('\t');
      return new CSVReaderBuilder(source.reader())
          .withCSVParser(parserBuilder.build())
          .build();
    }
    return new CSVReader(source.reader());
  }

  /**
   * Reads one line ahead; closes the reader when the file is exhausted.
   */
  private static class RowIterator implements Iterator<List<?>>, AutoCloseable {
    private final CSVReader reader;
    private String @Nullable [] next;
    private boolean fetched;
    private boolean closed;

    RowIterator(CSVReader reader) {
      this.reader = reader;
    }

    @Override public boolean hasNext() {
      if (!fetched) {
        next = readNext();
        fetched = true;
        if (next == null) {
          close();
        }
      }
      return next != null;
    }

    @Override public List<?> next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      fetched = false;
      return Arrays.asList(next);
    }

    private String @Nullable [] readNext() {
      if (closed) {
        return null;
      }
      try {
        return reader.readNext();
      } catch (IOException e) {
        throw new UncheckedIOException("Error reading CSV row", e);
      } catch (CsvValidationException e) {
        throw new IllegalStateException("Malformed CSV row at line "
            + reader.getLinesRead(), e);
      }
    }

    @Override public void close() {
      if (closed) {
        return;
      }
      closed = true;
      try {
        reader.close();
      } catch (IOException e) {
        throw new UncheckedIOException("Error closing CSV reader", e);
      }
    }
  }
}
