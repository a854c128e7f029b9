package io.github.mandar2812.imagcdf;

import java.util.Arrays;

/**
 * Builds sample datasets for tests.
 */
class Fixtures {

    private Fixtures() {
    }

    /**
     * Returns metadata for a minute-mean dataset from Alibag.
     */
    static Metadata createMetadata() throws ImagCdfException {
        Metadata md = new Metadata();
        md.setIagaCode( "ABG" );
        md.setElementsRecorded( "HDZS" );
        md.setPublicationLevel( PublicationLevel.LEVEL_2 );
        md.setPublicationDate( Tt2000.toEpoch( 2014, 3, 1, 0, 0, 0 ) );
        md.setObservatoryName( "Alibag" );
        md.setLatitude( 18.638 );
        md.setLongitude( 72.872 );
        md.setElevation( 7.0 );
        md.setInstitution( "Indian Institute of Geomagnetism" );
        md.setVectorSensOrient( "HDZ" );
        md.setStandardLevel( StandardLevel.PARTIAL );
        md.setStandardName( "INTERMAGNET_1-Minute" );
        md.setStandardVersion( "1.1" );
        md.setPartialStandDesc( "IMOM-11,IMOM-12" );
        md.setSource( "institute" );
        md.setUniqueIdentifier( "doi:10.0000/abg.2014" );
        md.setParentIdentifiers( Arrays.asList( "abg_2014_parent_a",
                                                "abg_2014_parent_b" ) );
        md.setReferenceLinks( Arrays.asList( "http://www.iigm.res.in/" ) );
        return md;
    }

    /**
     * Returns a field element variable with samples 0, 1, 2...
     * scaled and offset.
     */
    static Variable createElement( String code, int n, double offset ) {
        double[] data = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            data[ i ] = offset + i * 0.1;
        }
        return new Variable( VariableType.GEOMAGNETIC_FIELD_ELEMENT, code,
                             "Geomagnetic Field Element " + code, "nT",
                             Variable.FILL_VALUE, -88880.0, 88880.0, null,
                             data );
    }

    /**
     * Returns a temperature channel variable.
     */
    static Variable createTemperature( String code, int n ) {
        double[] data = new double[ n ];
        for ( int i = 0; i < n; i++ ) {
            data[ i ] = 20.0 + i;
        }
        return new Variable( VariableType.TEMPERATURE, code,
                             "Temperature " + code, "Celsius",
                             Variable.FILL_VALUE, -273.15, 1000.0, null,
                             data );
    }
}
