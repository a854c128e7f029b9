package io.github.mandar2812.imagcdf;

import java.io.File;
import java.io.IOException;

import io.github.mandar2812.imagcdf.container.Compression;
import io.github.mandar2812.imagcdf.container.MemoryCdfContainer;
import io.github.mandar2812.imagcdf.container.MemoryCdfContainerFactory;
import io.github.mandar2812.imagcdf.container.OpenMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

class ImagCdfContentTest {

    private MemoryCdfContainerFactory factory_;
    private File file_;
    private Metadata md_;
    private Variable[] vars_;
    private TimeSeries[] series_;

    @BeforeEach
    void setUp() throws ImagCdfException {
        factory_ = new MemoryCdfContainerFactory();
        md_ = Fixtures.createMetadata();
        file_ = new File( ImagCdfFilenames
                         .makeFilename( null, md_.getIagaCode(),
                                        Tt2000.toEpoch( 2014, 3, 1, 0, 0, 0 ),
                                        md_.getPublicationLevel(),
                                        Cadence.MINUTE, Coverage.DAILY,
                                        true ) );
        vars_ = new Variable[] {
            Fixtures.createElement( "H", 5, 37000.0 ),
            Fixtures.createElement( "D", 5, -0.5 ),
            Fixtures.createElement( "Z", 5, 21000.0 ),
            Fixtures.createElement( "S", 2, 42000.0 ),
            Fixtures.createTemperature( "1", 1 ),
        };
        long start = Tt2000.toEpoch( 2014, 3, 1, 0, 0, 0 );
        series_ = new TimeSeries[] {
            new TimeSeries( TimeSeries.VECTOR_TIMES,
                            Tt2000.makeSeries( start, 60, 5 ) ),
            new TimeSeries( TimeSeries.SCALAR_TIMES,
                            Tt2000.makeSeries( start, 120, 2 ) ),
            new TimeSeries( TimeSeries.getTemperatureTimesName( "1" ),
                            Tt2000.makeSeries( start, 300, 1 ) ),
        };
    }

    @Test
    void testWriteReadFile() throws ImagCdfException {
        assertEquals( "abg_20140301_pt1m_2.cdf", file_.getName() );
        Metadata written =
            ImagCdfWriter.writeFile( factory_, file_, OpenMode.CREATE,
                                     Compression.gzip( 5 ), md_, vars_,
                                     series_, false );
        ImagCdfContent content = ImagCdfContent.readFile( factory_, file_ );

        assertEquals( written, content.getMetadata() );
        Variable[] elements = content.getElements();
        assertEquals( 4, elements.length );
        assertEquals( "H", elements[ 0 ].getCode() );
        assertEquals( "S", elements[ 3 ].getCode() );
        assertArrayEquals( vars_[ 2 ].getData(), elements[ 2 ].getData() );
        assertEquals( TimeSeries.SCALAR_TIMES, elements[ 3 ].getDepend0() );

        Variable[] temps = content.getTemperatures();
        assertEquals( 1, temps.length );
        assertEquals( VariableType.TEMPERATURE, temps[ 0 ].getType() );
        assertEquals( 5, content.getVariables().length );

        TimeSeries[] series = content.getTimeSeries();
        assertEquals( 3, series.length );
        assertEquals( TimeSeries.VECTOR_TIMES, series[ 0 ].getName() );
        assertEquals( TimeSeries.SCALAR_TIMES, series[ 1 ].getName() );
        assertEquals( "Temperature1Times", series[ 2 ].getName() );
        assertArrayEquals( series_[ 0 ].getStamps(),
                           content.getTimeSeries( elements[ 1 ] )
                                  .getStamps() );
        assertEquals( 60, Tt2000.samplePeriod( series[ 0 ].getStamps() ) );
    }

    @Test
    void testGivenDepend() throws ImagCdfException {
        Variable s = new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, "S",
                                   "Geomagnetic Field Element S", "nT",
                                   Variable.FILL_VALUE, 0.0, 88880.0,
                                   TimeSeries.VECTOR_TIMES, new double[ 5 ] );
        Variable h = new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, "H",
                                   "Geomagnetic Field Element H", "nT",
                                   Variable.FILL_VALUE, 0.0, 88880.0,
                                   TimeSeries.VECTOR_TIMES, new double[ 5 ] );
        md_.setElementsRecorded( "HS" );
        ImagCdfWriter.writeFile( factory_, file_, OpenMode.FORCE_CREATE,
                                 Compression.NONE, md_,
                                 new Variable[] { h, s },
                                 new TimeSeries[] { series_[ 0 ] }, true );
        ImagCdfContent content = ImagCdfContent.readFile( factory_, file_ );
        assertEquals( 1, content.getTimeSeries().length );
        assertSame( content.getTimeSeries( content.getElements()[ 0 ] ),
                    content.getTimeSeries( content.getElements()[ 1 ] ) );
    }

    @Test
    void testLengthMismatchWritesNothing() throws IOException {
        MemoryCdfContainer container = new MemoryCdfContainer();
        Variable[] vars = { Fixtures.createElement( "H", 4, 0.0 ) };
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> new ImagCdfWriter( container, false )
                               .write( md_, vars, series_ ) );
        assertEquals( ImagCdfException.Kind.INVALID_ARGUMENT, e.getKind() );
        assertNull( container.getGlobalEntry( MetadataCodec.TITLE, 0 ) );
        assertFalse( container.hasVariable( "GeomagneticFieldH" ) );
    }

    @Test
    void testMissingSeries() throws ImagCdfException {
        MemoryCdfContainer container = new MemoryCdfContainer();
        new ImagCdfWriter( container, false )
           .write( md_, vars_, new TimeSeries[] { series_[ 0 ] } );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> new ImagCdfContent( container ) );
        assertTrue( e.isNotFound() );
        assertTrue( e.getMessage().contains( TimeSeries.SCALAR_TIMES ) );
    }

    @Test
    void testMissingElement() throws ImagCdfException {
        MemoryCdfContainer container = new MemoryCdfContainer();
        md_.setElementsRecorded( "HDZF" );
        new ImagCdfWriter( container, false ).write( md_, vars_, series_ );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> new ImagCdfContent( container ) );
        assertTrue( e.isNotFound() );
        assertEquals( "read GeomagneticFieldF not found", e.getMessage() );
    }

    @Test
    void testShortSeriesTolerated() throws ImagCdfException {
        MemoryCdfContainer container = new MemoryCdfContainer();
        md_.setElementsRecorded( "H" );
        MetadataCodec.write( container, md_ );
        VariableCodec.write( container, vars_[ 0 ], false );
        TimeSeriesCodec.write( container,
                               new TimeSeries( TimeSeries.VECTOR_TIMES,
                                               new long[ 2 ] ) );
        ImagCdfContent content = new ImagCdfContent( container );
        assertEquals( 5, content.getElements()[ 0 ].getDataLength() );
        assertEquals( 2, content.getTimeSeries()[ 0 ].getLength() );
    }

    @Test
    void testReadNoFile() {
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> ImagCdfContent.readFile( factory_, file_ ) );
        assertEquals( ImagCdfException.Kind.COLLABORATOR, e.getKind() );
        assertEquals( MemoryCdfContainerFactory.NO_SUCH_CDF, e.getStatus() );
    }

    @Test
    void testCreateExisting() throws ImagCdfException {
        ImagCdfWriter.writeFile( factory_, file_, OpenMode.CREATE,
                                 Compression.NONE, md_, vars_, series_,
                                 false );
        ImagCdfException e =
            assertThrows( ImagCdfException.class,
                          () -> ImagCdfWriter
                               .writeFile( factory_, file_, OpenMode.CREATE,
                                           Compression.NONE, md_, vars_,
                                           series_, false ) );
        assertEquals( MemoryCdfContainerFactory.CDF_EXISTS, e.getStatus() );
    }
}
