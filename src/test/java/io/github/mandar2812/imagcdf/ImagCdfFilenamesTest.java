package io.github.mandar2812.imagcdf;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import static org.junit.jupiter.api.Assertions.*;

class ImagCdfFilenamesTest {

    private long start_;

    @BeforeEach
    void setUp() throws ImagCdfException {
        start_ = Tt2000.toEpoch( 1980, 1, 1, 0, 0, 0 );
    }

    @Test
    void testMakeFilename_MinuteDaily() {
        assertEquals( "afo_19800101_pt1m_1.cdf",
                      ImagCdfFilenames
                     .makeFilename( null, "AFO", start_,
                                    PublicationLevel.LEVEL_1, Cadence.MINUTE,
                                    Coverage.DAILY, true ) );
    }

    @Test
    void testMakeFilename_PrefixKeepsCase() {
        assertEquals( "/Data/IMAG/AFO_19800101_pt1m_1.cdf",
                      ImagCdfFilenames
                     .makeFilename( "/Data/IMAG/", "AFO", start_,
                                    PublicationLevel.LEVEL_1, Cadence.MINUTE,
                                    Coverage.DAILY, false ) );
        assertEquals( "/Data/IMAG/afo_19800101_pt1m_1.cdf",
                      ImagCdfFilenames
                     .makeFilename( "/Data/IMAG/", "AFO", start_,
                                    PublicationLevel.LEVEL_1, Cadence.MINUTE,
                                    Coverage.DAILY, true ) );
    }

    @ParameterizedTest
    @CsvSource({
            "ANNUAL,  abg_2014_p1y_4.cdf",
            "MONTHLY, abg_201403_p1y_4.cdf",
            "DAILY,   abg_20140305_p1y_4.cdf",
            "HOURLY,  abg_20140305_06_p1y_4.cdf",
            "MINUTE,  abg_20140305_0607_p1y_4.cdf",
            "SECOND,  abg_20140305_060708_p1y_4.cdf"
    })
    void testMakeFilename_Coverage( Coverage coverage, String expected )
            throws ImagCdfException {
        long start = Tt2000.toEpoch( 2014, 3, 5, 6, 7, 8 );
        assertEquals( expected,
                      ImagCdfFilenames
                     .makeFilename( "", "ABG", start,
                                    PublicationLevel.LEVEL_4, Cadence.ANNUAL,
                                    coverage, true ) );
    }

    @Test
    void testMakeFilename_MissingCadenceAndCoverage() {
        assertEquals( "afo_19800101_000000_unkn_3.cdf",
                      ImagCdfFilenames
                     .makeFilename( null, "AFO", start_,
                                    PublicationLevel.LEVEL_3, null, null,
                                    true ) );
        assertEquals( "AFO_19800101_unkn_3.cdf",
                      ImagCdfFilenames
                     .makeFilename( null, "AFO", start_,
                                    PublicationLevel.LEVEL_3, null,
                                    Coverage.DAILY, false ) );
    }

    @Test
    void testMakeFilename_FromSamplePeriod() {
        assertEquals( "afo_19800101_0000_pt1m_2.cdf",
                      ImagCdfFilenames
                     .makeFilename( null, "AFO", start_,
                                    PublicationLevel.LEVEL_2, 60.0, true ) );
        assertEquals( "afo_19800101_p1d_2.cdf",
                      ImagCdfFilenames
                     .makeFilename( null, "AFO", start_,
                                    PublicationLevel.LEVEL_2, 86400.0,
                                    true ) );
    }
}
