package com.noi.backend.services.extraction.preprocessing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.noi.backend.services.extraction.UnsupportedFormatException;

class DelimitedTextReaderTest {

    private final DelimitedTextReader reader = new DelimitedTextReader();

    @Test
    void read_handlesQuotedThousandsAndSemicolons() {
        String csv = "Category;Amount\n\"Gross Potential Rent\";\"120,000.00\"\nInsurance;2400\n";

        TableBlock table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "stmt.csv");

        assertEquals(List.of("Category", "Amount"), table.headers());
        assertEquals("120,000.00", table.cell(0, 1));
        assertEquals("Insurance", table.cell(1, 0));
    }

    @Test
    void read_joinsQuotedLineBreaks() {
        String csv = "Category,Amount\n\"Repairs &\nMaintenance\",\"3,100\"\n";

        TableBlock table = reader.read(csv.getBytes(StandardCharsets.UTF_8), "stmt.csv");

        assertEquals(1, table.rows().size());
        assertEquals("Repairs & Maintenance", table.cell(0, 0));
        assertEquals("3,100", table.cell(0, 1));
    }

    @Test
    void read_rejectsEmptyFile() {
        assertThrows(UnsupportedFormatException.class, () -> reader.read(new byte[] {' ', '\n'}, "empty.csv"));
    }

    @Test
    void detectDelimiter_prefersConsistentSplit() {
        assertEquals('\t', DelimitedTextReader.detectDelimiter(List.of("a\tb", "c\td", "1,2\t3")));
        assertEquals(',', DelimitedTextReader.detectDelimiter(List.of("no delimiters here")));
    }

    @Test
    void splitLine_unescapesDoubledQuotes() {
        assertEquals(List.of("say \"hi\"", "2"), DelimitedTextReader.splitLine("\"say \"\"hi\"\"\",2", ','));
    }
}
