package io.github.mandar2812.imagcdf;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import static org.junit.jupiter.api.Assertions.*;

class LookupTest {

    // ========== Publication level ==========

    @Test
    void testPublicationLevel_Codes() {
        assertEquals( "1", PublicationLevel.LEVEL_1.getCode() );
        assertEquals( "4", PublicationLevel.LEVEL_4.getCode() );
        assertEquals( PublicationLevel.LEVEL_3,
                      PublicationLevel.fromCode( " 3 " ) );
        assertNull( PublicationLevel.fromCode( "5" ) );
        assertNull( PublicationLevel.fromCode( null ) );
    }

    @ParameterizedTest
    @CsvSource({
            "variation, LEVEL_1",
            "R,         LEVEL_1",
            "provisional, LEVEL_2",
            "adjusted,  LEVEL_2",
            "q,         LEVEL_3",
            "Definitive, LEVEL_4",
            "xyz,       LEVEL_1"
    })
    void testPublicationLevel_FromDataType( String dataType,
                                            PublicationLevel expected ) {
        assertEquals( expected, PublicationLevel.fromDataType( dataType ) );
    }

    @Test
    void testPublicationLevel_FromEmptyDataType() {
        assertEquals( PublicationLevel.LEVEL_1,
                      PublicationLevel.fromDataType( "" ) );
        assertEquals( PublicationLevel.LEVEL_1,
                      PublicationLevel.fromDataType( null ) );
    }

    // ========== Standard level ==========

    @Test
    void testStandardLevel() {
        assertEquals( "Partial", StandardLevel.PARTIAL.getCode() );
        assertEquals( StandardLevel.FULL, StandardLevel.fromCode( "full" ) );
        assertEquals( StandardLevel.NONE, StandardLevel.fromCode( " NONE" ) );
        assertNull( StandardLevel.fromCode( "Some" ) );
    }

    // ========== Variable type ==========

    @Test
    void testVariableType() {
        assertEquals( "GeomagneticField",
                      VariableType.GEOMAGNETIC_FIELD_ELEMENT.getPrefix() );
        assertEquals( "GeomagneticFieldElement",
                      VariableType.GEOMAGNETIC_FIELD_ELEMENT.toString() );
        assertEquals( "Temperature", VariableType.TEMPERATURE.getPrefix() );
        assertEquals( VariableType.TEMPERATURE,
                      VariableType.fromName( "temperature" ) );
        assertNull( VariableType.fromName( "Pressure" ) );
    }

    // ========== Element classification ==========

    @ParameterizedTest
    @ValueSource(strings = { "X", "Y", "Z", "H", "D", "E", "V", "I", "F",
                             "x", "dbdt" })
    void testElementClass_Vector( String code ) {
        assertEquals( ElementClass.VECTOR,
                      ElementClass.classify( VariableType
                                            .GEOMAGNETIC_FIELD_ELEMENT,
                                             code ) );
        assertTrue( VariableCodec.isVector( VariableType
                                           .GEOMAGNETIC_FIELD_ELEMENT,
                                            code ) );
        assertFalse( VariableCodec.isScalar( VariableType
                                            .GEOMAGNETIC_FIELD_ELEMENT,
                                             code ) );
    }

    @ParameterizedTest
    @ValueSource(strings = { "S", "G", "s" })
    void testElementClass_Scalar( String code ) {
        assertEquals( ElementClass.SCALAR,
                      ElementClass.classify( VariableType
                                            .GEOMAGNETIC_FIELD_ELEMENT,
                                             code ) );
        assertTrue( VariableCodec.isScalar( VariableType
                                           .GEOMAGNETIC_FIELD_ELEMENT,
                                            code ) );
    }

    @Test
    void testElementClass_Other() {
        assertNull( ElementClass.classify( VariableType
                                          .GEOMAGNETIC_FIELD_ELEMENT, "Q" ) );
        assertNull( ElementClass.classify( VariableType
                                          .GEOMAGNETIC_FIELD_ELEMENT, "" ) );
        assertNull( ElementClass.classify( null, "X" ) );
        assertEquals( ElementClass.TEMPERATURE,
                      ElementClass.classify( VariableType.TEMPERATURE, "1" ) );
        assertFalse( VariableCodec.isVector( VariableType.TEMPERATURE, "X" ) );
    }

    // ========== Cadence and coverage ==========

    @ParameterizedTest
    @CsvSource({
            "0.5,     SECOND",
            "1,       SECOND",
            "1.5,     MINUTE",
            "60,      MINUTE",
            "3600,    HOURLY",
            "86400,   DAILY",
            "2678400, MONTHLY",
            "2678401, ANNUAL"
    })
    void testCadence_ForSamplePeriod( double seconds, Cadence expected ) {
        assertEquals( expected, Cadence.forSamplePeriod( seconds ) );
    }

    @Test
    void testCadence_Tags() {
        assertEquals( "pt1m", Cadence.MINUTE.getTag() );
        assertEquals( "p1y", Cadence.ANNUAL.getTag() );
        assertEquals( "unkn", Cadence.UNKNOWN.getTag() );
    }

    @Test
    void testCoverage_ForCadence() {
        assertEquals( Coverage.DAILY, Coverage.forCadence( Cadence.DAILY ) );
        assertEquals( Coverage.MINUTE, Coverage.forCadence( Cadence.MINUTE ) );
        assertEquals( Coverage.SECOND,
                      Coverage.forCadence( Cadence.UNKNOWN ) );
    }
}
