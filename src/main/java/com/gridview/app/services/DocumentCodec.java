package com.gridview.app.services;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.gridview.app.exceptions.DocumentSaveException;
import com.gridview.app.exceptions.MalformedDocumentException;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads and writes the on-disk CSV form of a grid. Every record,
 * the header line included, becomes an ordinary row.
 */
@Service
public class DocumentCodec {

    private final ObjectReader rowReader;
    private final ObjectWriter rowWriter;

    public DocumentCodec() {
        CsvMapper mapper = new CsvMapper();
        this.rowReader = mapper.readerFor(String[].class).with(CsvParser.Feature.WRAP_AS_ARRAY);
        this.rowWriter = mapper.writerFor(String[].class);
    }

    /**
     * Parses UTF-8 CSV bytes into rows (not normalized; rows may differ in length).
     *
     * @throws MalformedDocumentException if the bytes are not UTF-8 or not CSV
     */
    public List<List<String>> decode(byte[] bytes, String name) {
        String text = decodeUtf8(bytes, name);
        List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> records = rowReader.readValues(text)) {
            while (records.hasNext()) {
                rows.add(new ArrayList<>(Arrays.asList(records.next())));
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new MalformedDocumentException(
                    "Document '" + name + "' is not valid CSV: " + e.getMessage(), e);
        }
        return rows;
    }

    /**
     * Writes rows as UTF-8 CSV, one record per row.
     *
     * @throws DocumentSaveException if encoding fails
     */
    public byte[] encode(List<List<String>> rows) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             SequenceWriter records = rowWriter.writeValues(writer)) {
            for (List<String> row : rows) {
                records.write(row.toArray(new String[0]));
            }
        } catch (IOException e) {
            throw new DocumentSaveException("Failed to encode document: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private static String decodeUtf8(byte[] bytes, String name) {
        if (bytes == null) {
            throw new MalformedDocumentException("Document '" + name + "' has no content");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new MalformedDocumentException("Document '" + name + "' is not UTF-8 text", e);
        }
    }
}
