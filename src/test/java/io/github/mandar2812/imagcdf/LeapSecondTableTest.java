package io.github.mandar2812.imagcdf;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.GregorianCalendar;
import java.util.TimeZone;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class LeapSecondTableTest {

    private static final String[] SMALL_TABLE = {
        "; test table",
        "",
        "1966  1  1   4.3131700  39126.0  0.0025920",
        "1972  1  1  10  0  0",
        "1972  7  1  11  0  0",
        "   ; indented comment",
        "1973  1  1  12  0  0",
        "1975  1  1  14  0  0",
    };

    @Test
    void testBuiltinTable() {
        LeapSecondTable table = LeapSecondTable.getInstance();
        assertSame( table, LeapSecondTable.getInstance() );
        assertEquals( 42, table.getChangeCount() );
        LeapSecondTable.Change last =
            table.getChange( table.getChangeCount() - 1 );
        assertEquals( 2017, last.year_ );
        assertEquals( 37.0, last.getOffsetSeconds( 60000.0 ) );
    }

    @Test
    void testParseChange() throws IOException {
        LeapSecondTable.Change fixed =
            LeapSecondTable.parseChange( "  2009  1  1  34  0  0 " );
        assertEquals( 2009, fixed.year_ );
        assertEquals( 1, fixed.month_ );
        assertEquals( 1, fixed.day_ );
        assertEquals( dayMillis( 2009, 1, 1 ), fixed.dayUnixMillis_ );
        assertEquals( 34.0, fixed.getOffsetSeconds( 55000.0 ) );
        assertEquals( "2009-1-1 TAI-UTC=34.0", fixed.toString() );

        LeapSecondTable.Change drifting =
            LeapSecondTable
           .parseChange( "1966  1  1   4.3131700  39126.0  0.0025920" );
        assertEquals( 4.31317, drifting.getOffsetSeconds( 39126.0 ), 1e-9 );
        assertEquals( 4.31317 + 100 * 0.002592,
                      drifting.getOffsetSeconds( 39226.0 ), 1e-9 );
        assertTrue( drifting.toString().contains( "MJD-39126.0" ) );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "2009 1 1 34 0",
        "2009 1 1 34 0 0 0",
        "2009 Jan 1 34 0 0",
        "2009 1 1 thirty-four 0 0",
        "",
    })
    void testParseChangeBad( String line ) {
        assertThrows( IOException.class,
                      () -> LeapSecondTable.parseChange( line ) );
    }

    @Test
    void testParseLines() throws IOException {
        LeapSecondTable table =
            LeapSecondTable.parseLines( SMALL_TABLE, "small" );
        assertEquals( 5, table.getChangeCount() );
        assertNull( table.getChangeForDay( dayMillis( 1965, 12, 31 ) ) );
        assertEquals( 1966,
                      table.getChangeForDay( dayMillis( 1971, 6, 1 ) ).year_ );
        assertSame( table.getChange( 3 ),
                    table.getChangeForDay( dayMillis( 1973, 1, 1 ) ) );
        assertSame( table.getChange( 4 ),
                    table.getChangeForDay( dayMillis( 2020, 1, 1 ) ) );

        assertTrue( table.hasLeapSecondBefore( dayMillis( 1972, 7, 1 ) ) );
        assertTrue( table.hasLeapSecondBefore( dayMillis( 1973, 1, 1 ) ) );
        assertFalse( table.hasLeapSecondBefore( dayMillis( 1972, 1, 1 ) ) );
        assertFalse( table.hasLeapSecondBefore( dayMillis( 1975, 1, 1 ) ) );
        assertFalse( table.hasLeapSecondBefore( dayMillis( 1966, 1, 1 ) ) );
        assertFalse( table.hasLeapSecondBefore( dayMillis( 1974, 1, 1 ) ) );
    }

    @Test
    void testParseLinesBad() {
        String[] badLine = { "; header", "1972  1  1  10  0  0", "junk" };
        IOException e1 =
            assertThrows( IOException.class,
                          () -> LeapSecondTable.parseLines( badLine, "bad" ) );
        assertTrue( e1.getMessage().startsWith( "bad line 3: " ) );

        String[] disordered = { "1973  1  1  12  0  0",
                                "1972  7  1  11  0  0" };
        IOException e2 =
            assertThrows( IOException.class,
                          () -> LeapSecondTable.parseLines( disordered,
                                                            "order" ) );
        assertTrue( e2.getMessage().startsWith( "order: " ) );

        String[] empty = { "; nothing here", "  " };
        assertThrows( IOException.class,
                      () -> LeapSecondTable.parseLines( empty, "empty" ) );
    }

    @Test
    void testReadFile( @TempDir File dir ) throws IOException {
        File file = new File( dir, "CDFLeapSeconds.txt" );
        Files.write( file.toPath(), Arrays.asList( SMALL_TABLE ),
                     StandardCharsets.US_ASCII );
        LeapSecondTable table = LeapSecondTable.readFile( file );
        assertEquals( 5, table.getChangeCount() );
        assertEquals( 14.0,
                      table.getChange( 4 ).getOffsetSeconds( 50000.0 ) );

        File missing = new File( dir, "absent.txt" );
        assertThrows( IOException.class,
                      () -> LeapSecondTable.readFile( missing ) );
    }

    private static long dayMillis( int year, int month, int day ) {
        GregorianCalendar cal =
            new GregorianCalendar( TimeZone.getTimeZone( "UTC" ) );
        cal.clear();
        cal.set( year, month - 1, day );
        return cal.getTimeInMillis();
    }
}
