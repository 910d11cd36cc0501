package org.forcecom.restapi.rest.csv;

import com.opencsv.CSVWriter;
import org.forcecom.restapi.model.QueryRecord;
import org.forcecom.restapi.rest.QueryResult;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes a {@link QueryResult} as CSV using OpenCSV.
 * The header row is the result's column set; absent and null values become empty cells.
 */
public class CsvResultWriter {

    /**
     * Writes the result. The writer is flushed but not closed.
     *
     * @param result Query result
     * @param writer Target
     * @throws IOException If writing fails
     */
    public void write(QueryResult result, Writer writer) throws IOException {
        List<String> columns = new ArrayList<>(result.getColumns());
        CSVWriter csvWriter = new CSVWriter(writer);
        csvWriter.writeNext(columns.toArray(new String[0]), false);
        for (QueryRecord record : result) {
            String[] row = new String[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                String value = record.get(columns.get(i));
                row[i] = value != null ? value : "";
            }
            csvWriter.writeNext(row, false);
        }
        csvWriter.flush();
        if (csvWriter.checkError()) {
            throw new IOException("Failed to write CSV output");
        }
    }
}
