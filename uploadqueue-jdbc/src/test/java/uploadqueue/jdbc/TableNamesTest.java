package uploadqueue.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

    @Test
    void validTableNameReturnsName() {
        assertEquals("pending_upload", TableNames.validate("pending_upload"));
        assertEquals("_uploads2", TableNames.validate("_uploads2"));
    }

    @Test
    void defaultTableConstant() {
        assertEquals("pending_upload", TableNames.DEFAULT_TABLE);
    }

    @Test
    void nullTableNameThrows() {
        assertThrows(NullPointerException.class, () -> TableNames.validate(null));
    }

    @Test
    void invalidTableNamesThrow() {
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("1uploads"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("pending-upload"));
        assertThrows(IllegalArgumentException.class, () -> TableNames.validate("uploads; DROP TABLE x"));
    }
}
