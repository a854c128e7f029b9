package io.github.mandar2812.imagcdf;

import java.io.IOException;
import java.util.List;

import io.github.mandar2812.imagcdf.container.MemoryCdfContainer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import static org.junit.jupiter.api.Assertions.*;

class VariableCodecTest {

    private MemoryCdfContainer container_;

    @BeforeEach
    void setUp() {
        container_ = new MemoryCdfContainer();
    }

    // ========== Naming ==========

    @Test
    void testVariableName() throws ImagCdfException {
        assertEquals( "GeomagneticFieldH",
                      VariableCodec
                     .getVariableName( VariableType.GEOMAGNETIC_FIELD_ELEMENT,
                                       "H" ) );
        assertEquals( "Temperature1",
                      VariableCodec.getVariableName( VariableType.TEMPERATURE,
                                                     "1" ) );
    }

    @Test
    void testVariableNameIllegal() throws ImagCdfException {
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec.getVariableName( null, "H" ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
        assertThrows( ImagCdfException.class,
                      () -> VariableCodec
                           .getVariableName( VariableType.TEMPERATURE, " " ) );

        // Prefix of 16 characters leaves room for 13.
        assertEquals( 29, VariableCodec
                         .getVariableName( VariableType
                                          .GEOMAGNETIC_FIELD_ELEMENT,
                                           "ABCDEFGHIJKLM" ).length() );
        e = assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .getVariableName( VariableType
                                                .GEOMAGNETIC_FIELD_ELEMENT,
                                                 "ABCDEFGHIJKLMN" ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
    }

    @ParameterizedTest
    @CsvSource({
            "GeomagneticFieldElement, X, GeomagneticVectorTimes",
            "GeomagneticFieldElement, D, GeomagneticVectorTimes",
            "GeomagneticFieldElement, f, GeomagneticVectorTimes",
            "GeomagneticFieldElement, S, GeomagneticScalarTimes",
            "GeomagneticFieldElement, G, GeomagneticScalarTimes",
            "Temperature,             2, Temperature2Times",
            "Temperature,             Outside, TemperatureOutsideTimes"
    })
    void testDependName( String typeName, String code, String expected )
            throws ImagCdfException {
        assertEquals( expected,
                      VariableCodec
                     .getDependName( VariableType.fromName( typeName ),
                                     code ) );
    }

    @Test
    void testDependNameUnknown() {
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .getDependName( VariableType
                                              .GEOMAGNETIC_FIELD_ELEMENT,
                                               "Q" ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
        assertThrows( ImagCdfException.class,
                      () -> VariableCodec
                           .getDependName( VariableType.TEMPERATURE, "" ) );
    }

    // ========== Write and read ==========

    @Test
    void testWriteRead() throws IOException {
        double[] data = { 1.5, -0.0, Double.NaN, Variable.FILL_VALUE,
                          Double.MIN_VALUE, 48231.123456789 };
        Variable var =
            new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, "Z",
                          "Geomagnetic Field Element Z", "nT",
                          Variable.FILL_VALUE, -88880.0, 88880.0, null,
                          data );
        assertEquals( "GeomagneticFieldZ",
                      VariableCodec.write( container_, var, false ) );

        Variable read =
            VariableCodec.read( container_,
                                VariableType.GEOMAGNETIC_FIELD_ELEMENT, "Z" );
        assertArrayEquals( data, read.getData() );
        assertEquals( "Geomagnetic Field Element Z", read.getFieldName() );
        assertEquals( "nT", read.getUnits() );
        assertEquals( Variable.FILL_VALUE, read.getFillValue() );
        assertEquals( -88880.0, read.getValidMin() );
        assertEquals( 88880.0, read.getValidMax() );
        assertEquals( TimeSeries.VECTOR_TIMES, read.getDepend0() );
        assertTrue( read.isFill( 3 ) );
        assertFalse( read.isFill( 0 ) );

        assertEquals( VariableCodec.TIME_SERIES_DISPLAY,
                      container_.getVariableEntry( VariableCodec.DISPLAY_TYPE,
                                                   "GeomagneticFieldZ" )
                                .getValue() );
        assertEquals( "Z",
                      container_.getVariableEntry( VariableCodec.LABLAXIS,
                                                   "GeomagneticFieldZ" )
                                .getValue() );
    }

    @Test
    void testTemperatureLabel() throws IOException {
        VariableCodec.write( container_, Fixtures.createTemperature( "1", 4 ),
                             false );
        assertEquals( "Temperature 1",
                      container_.getVariableEntry( VariableCodec.LABLAXIS,
                                                   "Temperature1" )
                                .getValue() );
        assertEquals( "Temperature1Times",
                      VariableCodec.read( container_, VariableType.TEMPERATURE,
                                          "1" ).getDepend0() );
    }

    @Test
    void testGivenDepend() throws ImagCdfException {
        Variable var =
            new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, "S",
                          "Geomagnetic Field Element S", "nT",
                          Variable.FILL_VALUE, 0.0, 88880.0,
                          "GeomagneticVectorTimes", new double[] { 48000.0 } );
        VariableCodec.write( container_, var, true );
        assertEquals( "GeomagneticVectorTimes",
                      VariableCodec.read( container_,
                                          VariableType
                                         .GEOMAGNETIC_FIELD_ELEMENT, "S" )
                                   .getDepend0() );
    }

    @Test
    void testGivenDependMissing() {
        Variable var = Fixtures.createElement( "H", 3, 20000.0 );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec.write( container_, var, true ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
    }

    @Test
    void testNullTextAttribute() {
        Variable var =
            new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, "H", null,
                          "nT", Variable.FILL_VALUE, 0.0, 1.0, null,
                          new double[ 1 ] );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec.write( container_, var,
                                                     false ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
    }

    @Test
    void testAppend() throws ImagCdfException {
        VariableCodec.write( container_,
                             Fixtures.createElement( "H", 3, 100.0 ), false );
        assertEquals( 5, VariableCodec
                        .append( container_,
                                 Fixtures.createElement( "H", 2, 200.0 ) ) );
        double[] data =
            VariableCodec.read( container_,
                                VariableType.GEOMAGNETIC_FIELD_ELEMENT, "H" )
                         .getData();
        assertArrayEquals( new double[] { 100.0, 100.1, 100.2, 200.0, 200.1 },
                           data, 1e-9 );
    }

    @Test
    void testAppendUnwritten() {
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .append( container_,
                                        Fixtures.createElement( "H", 2,
                                                                0.0 ) ) );
        assertEquals( ImagCdfException.Kind.NOT_FOUND, e.getKind() );
    }

    @Test
    void testWriteTwiceAppends() throws ImagCdfException {
        VariableCodec.write( container_,
                             Fixtures.createElement( "D", 2, 0.0 ), false );
        VariableCodec.write( container_,
                             Fixtures.createElement( "D", 3, 0.0 ), false );
        assertEquals( 5, VariableCodec
                        .read( container_,
                               VariableType.GEOMAGNETIC_FIELD_ELEMENT, "D" )
                        .getDataLength() );
    }

    // ========== Discovery and failures ==========

    @Test
    void testReadTemperatures() throws ImagCdfException {
        VariableCodec.write( container_, Fixtures.createTemperature( "1", 3 ),
                             false );
        VariableCodec.write( container_, Fixtures.createTemperature( "2", 3 ),
                             false );
        VariableCodec.write( container_, Fixtures.createTemperature( "4", 3 ),
                             false );
        List<Variable> temps = VariableCodec.readTemperatures( container_ );
        assertEquals( 2, temps.size() );
        assertEquals( "1", temps.get( 0 ).getCode() );
        assertEquals( "2", temps.get( 1 ).getCode() );

        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec.read( container_,
                                                    VariableType.TEMPERATURE,
                                                    "3" ) );
        assertTrue( e.isNotFound() );
        assertEquals( "read Temperature3 not found", e.getMessage() );
        assertNull( VariableCodec.find( container_, VariableType.TEMPERATURE,
                                        "3" ) );
    }

    @Test
    void testNoTemperatures() throws ImagCdfException {
        assertTrue( VariableCodec.readTemperatures( container_ ).isEmpty() );
    }

    @Test
    void testMissingAttribute() throws IOException {
        container_.createVariable( "GeomagneticFieldX", DataType.DOUBLE );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .read( container_,
                                      VariableType.GEOMAGNETIC_FIELD_ELEMENT,
                                      "X" ) );
        assertEquals( ImagCdfException.Kind.NOT_FOUND, e.getKind() );
        assertEquals( "read GeomagneticFieldX FIELDNAM not found",
                      e.getMessage() );
    }

    @Test
    void testDimensionedVariable() throws IOException {
        container_.createVariable( "GeomagneticFieldX", DataType.DOUBLE, 1 );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .read( container_,
                                      VariableType.GEOMAGNETIC_FIELD_ELEMENT,
                                      "X" ) );
        assertEquals( ImagCdfException.Kind.TYPE_MISMATCH, e.getKind() );
    }

    @Test
    void testWrongRecordType() throws IOException {
        container_.createVariable( "GeomagneticFieldX", DataType.TIME_TT2000 );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .write( container_,
                                       Fixtures.createElement( "X", 1, 0.0 ),
                                       false ) );
        assertEquals( ImagCdfException.Kind.TYPE_MISMATCH, e.getKind() );
    }

    @Test
    void testClosedContainer() {
        container_.close();
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> VariableCodec
                               .write( container_,
                                       Fixtures.createElement( "X", 1, 0.0 ),
                                       false ) );
        assertEquals( ImagCdfException.Kind.COLLABORATOR, e.getKind() );
        assertEquals( MemoryCdfContainer.BAD_CDF_ID, e.getStatus() );
    }
}
