package com.trust.network.ingest;

import com.trust.network.core.model.IdentityMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IdentityCsvReaderTest {

    private final IdentityCsvReader reader = new IdentityCsvReader();

    @Test
    @DisplayName("Should key identities by Index and join first and last name")
    void readsPeople() throws IOException {
        String csv = """
                Index,User Id,First Name,Last Name,Sex,Email,Phone,Date of birth,Job Title
                1,8717bbf45cCDbEe,Shelia,Mahoney,Male,pwarner@example.org,857.139.8239,2014-01-27,Probation officer
                2,3d5AD30A4cD38ed,Jo,Rivers,Female,fergusonkatherine@example.net,,1931-07-26,Dancer
                """;

        Map<Long, IdentityMetadata> identities = reader.read(new StringReader(csv));

        assertEquals(2, identities.size());
        IdentityMetadata shelia = identities.get(1L);
        assertEquals("Shelia Mahoney", shelia.name());
        assertEquals("Probation officer", shelia.job());
        assertEquals("pwarner@example.org", shelia.email());
        assertEquals("857.139.8239", shelia.phone());
        assertEquals(IdentityMetadata.NOT_AVAILABLE, identities.get(2L).phone());
    }

    @Test
    @DisplayName("Column order and case should not matter; missing columns default")
    void flexibleColumns() throws IOException {
        String csv = """
                JOB TITLE,index,first name
                Engineer,5,Lin
                """;

        IdentityMetadata lin = reader.read(new StringReader(csv)).get(5L);

        assertEquals("Lin", lin.name());
        assertEquals("Engineer", lin.job());
        assertEquals(IdentityMetadata.NOT_AVAILABLE, lin.email());
    }

    @Test
    @DisplayName("Rows with an invalid index should be skipped")
    void skipsInvalidIndex() throws IOException {
        String csv = """
                Index,First Name
                abc,Nobody
                ,Empty
                3,Valid
                """;

        Map<Long, IdentityMetadata> identities = reader.read(new StringReader(csv));

        assertEquals(1, identities.size());
        assertTrue(identities.containsKey(3L));
    }

    @Test
    @DisplayName("A table without an Index column should be rejected")
    void requiresIndex() {
        assertThrows(IOException.class, () -> reader.read(new StringReader("Name,Email\nA,b@c\n")));
    }

    @Test
    @DisplayName("An empty table yields no identities")
    void emptyTable() throws IOException {
        assertTrue(reader.read(new StringReader("")).isEmpty());
    }
}
