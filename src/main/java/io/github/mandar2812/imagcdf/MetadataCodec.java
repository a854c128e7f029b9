package io.github.mandar2812.imagcdf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.container.CdfContainer;

/**
 * Maps {@link Metadata} to and from the global attributes of a container.
 *
 * <p>Each property is held as entry 0 of a global attribute of the
 * same name, except for the parent identifiers and reference links,
 * which occupy entries 0..n-1 of their attribute.  No count is stored;
 * on read, entries are probed in turn until one is absent.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class MetadataCodec {

    public static final String FORMAT_DESCRIPTION = "FormatDescription";
    public static final String FORMAT_VERSION = "FormatVersion";
    public static final String TITLE = "Title";
    public static final String IAGA_CODE = "IagaCode";
    public static final String ELEMENTS_RECORDED = "ElementsRecorded";
    public static final String PUBLICATION_LEVEL = "PublicationLevel";
    public static final String PUBLICATION_DATE = "PublicationDate";
    public static final String OBSERVATORY_NAME = "ObservatoryName";
    public static final String LATITUDE = "Latitude";
    public static final String LONGITUDE = "Longitude";
    public static final String ELEVATION = "Elevation";
    public static final String INSTITUTION = "Institution";
    public static final String VECTOR_SENS_ORIENT = "VectorSensOrient";
    public static final String STANDARD_LEVEL = "StandardLevel";
    public static final String STANDARD_NAME = "StandardName";
    public static final String STANDARD_VERSION = "StandardVersion";
    public static final String PARTIAL_STAND_DESC = "PartialStandDesc";
    public static final String SOURCE = "Source";
    public static final String TERMS_OF_USE = "TermsOfUse";
    public static final String UNIQUE_IDENTIFIER = "UniqueIdentifier";
    public static final String PARENT_IDENTIFIERS = "ParentIdentifiers";
    public static final String REFERENCE_LINKS = "ReferenceLinks";

    /** Required value of the Title attribute. */
    public static final String CANONICAL_TITLE =
        "Geomagnetic time series data";

    /** Required value of the FormatDescription attribute. */
    public static final String CANONICAL_DESCRIPTION =
        "INTERMAGNET CDF Format";

    /** Format version written when none is given. */
    public static final String DEFAULT_FORMAT_VERSION = "1.3";

    /** Oldest readable format version, in tenths. */
    public static final int MIN_FORMAT_VERSION = 11;

    /** Newest readable format version, in tenths. */
    public static final int MAX_FORMAT_VERSION = 13;

    private static final String TERMS_OF_USE_TEXT = new StringBuffer()
        .append( "CONDITIONS OF USE FOR DATA PROVIDED THROUGH INTERMAGNET:\n" )
        .append( "The data made available through INTERMAGNET are provided"
               + " for\n" )
        .append( "your use and are not for commercial use or sale or"
               + " distribution\n" )
        .append( "to third parties without the written permission of the"
               + " institute\n" )
        .append( "(http://www.intermagnet.org/Institutes_e.html) operating\n" )
        .append( "the observatory. Publications making use of the data\n" )
        .append( "should include an acknowledgment statement of the form"
               + " given below.\n" )
        .append( "A citation reference should be sent to the INTERMAGNET"
               + " Secretary\n" )
        .append( "(secretary@intermagnet.org) for inclusion in a"
               + " publications list\n" )
        .append( "on the INTERMAGNET website.\n" )
        .append( "\n" )
        .append( "     ACKNOWLEDGEMENT OF DATA FROM OBSERVATORIES\n" )
        .append( "     PARTICIPATING IN INTERMAGNET\n" )
        .append( "We offer two acknowledgement templates. The first is for"
               + " cases\n" )
        .append( "where data from many observatories have been used and it"
               + " is not\n" )
        .append( "practical to list them all, or each of their operating"
               + " institutes.\n" )
        .append( "The second is for cases where research results have been"
               + " produced\n" )
        .append( "using a smaller set of observatories.\n" )
        .append( "\n" )
        .append( "     Suggested Acknowledgement Text (template 1)\n" )
        .append( "The results presented in this paper rely on data"
               + " collected\n" )
        .append( "at magnetic observatories. We thank the national institutes"
               + " that\n" )
        .append( "support them and INTERMAGNET for promoting high standards"
               + " of\n" )
        .append( "magnetic observatory practice (www.intermagnet.org).\n" )
        .append( "\n" )
        .append( "     Suggested Acknowledgement Text (template 2)\n" )
        .append( "The results presented in this paper rely on the data\n" )
        .append( "collected at <observatory name>. We thank <institute"
               + " name>,\n" )
        .append( "for supporting its operation and INTERMAGNET for promoting"
               + " high\n" )
        .append( "standards of magnetic observatory practice"
               + " (www.intermagnet.org).\n" )
        .toString();

    private static final Logger logger_ =
        Logger.getLogger( MetadataCodec.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private MetadataCodec() {
    }

    /**
     * Writes metadata to the global attributes of a container.
     * Blank title, format description, format version and terms of use
     * are first replaced by their defaults; the supplied object is not
     * modified.  Blank optional properties are not written.
     *
     * <p>The container cannot delete attribute entries, so metadata
     * already present may only be overwritten by metadata with at least
     * as many entries: every optional property already present must be
     * supplied again, and list properties may not get shorter.
     * Otherwise nothing is written.
     *
     * @param  container  open container
     * @param  metadata   metadata to write
     * @return  the metadata as written, with defaults applied
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if a required
     *         property is missing or earlier entries would be left
     *         behind, VALIDATION if the metadata breaks
     *         format rules, or COLLABORATOR if the container fails
     */
    public static Metadata write( CdfContainer container, Metadata metadata )
            throws ImagCdfException {
        Metadata md = applyDefaults( metadata );
        checkRequired( md );
        validate( md );
        checkOverwrite( container, md );
        putText( container, FORMAT_DESCRIPTION, md.getFormatDescription() );
        putText( container, FORMAT_VERSION, md.getFormatVersion() );
        putText( container, TITLE, md.getTitle() );
        putText( container, IAGA_CODE, md.getIagaCode() );
        putText( container, ELEMENTS_RECORDED, md.getElementsRecorded() );
        putText( container, PUBLICATION_LEVEL,
                 md.getPublicationLevel().getCode() );
        AttributeIo.putGlobal( container, "write", PUBLICATION_DATE, 0,
                               AttributeEntry
                              .createTt2000( md.getPublicationDate() ) );
        putText( container, OBSERVATORY_NAME, md.getObservatoryName() );
        putDouble( container, LATITUDE, md.getLatitude() );
        putDouble( container, LONGITUDE, md.getLongitude() );
        putDouble( container, ELEVATION, md.getElevation() );
        putText( container, INSTITUTION, md.getInstitution() );
        putOptionalText( container, VECTOR_SENS_ORIENT,
                         md.getVectorSensOrient() );
        putText( container, STANDARD_LEVEL, md.getStandardLevel().getCode() );
        putOptionalText( container, STANDARD_NAME, md.getStandardName() );
        putOptionalText( container, STANDARD_VERSION,
                         md.getStandardVersion() );
        putOptionalText( container, PARTIAL_STAND_DESC,
                         md.getPartialStandDesc() );
        putText( container, SOURCE, md.getSource() );
        putText( container, TERMS_OF_USE, md.getTermsOfUse() );
        putOptionalText( container, UNIQUE_IDENTIFIER,
                         md.getUniqueIdentifier() );
        putEntries( container, PARENT_IDENTIFIERS,
                    md.getParentIdentifiers() );
        putEntries( container, REFERENCE_LINKS, md.getReferenceLinks() );
        logger_.config( "Wrote ImagCDF metadata for " + md.getIagaCode() );
        return md;
    }

    /**
     * Reads and validates metadata from the global attributes of
     * a container.  Absent optional properties are returned as null.
     *
     * @param  container  open container
     * @return  metadata
     * @throws ImagCdfException  with kind NOT_FOUND if a required
     *         attribute is absent, TYPE_MISMATCH if an attribute has
     *         the wrong type, VALIDATION if the content breaks format
     *         rules, or COLLABORATOR if the container fails
     */
    public static Metadata read( CdfContainer container )
            throws ImagCdfException {
        String formatDescription =
            getText( container, FORMAT_DESCRIPTION, true );
        String formatVersion = getText( container, FORMAT_VERSION, true );
        String title = getText( container, TITLE, true );
        String iagaCode = getText( container, IAGA_CODE, true );
        String elementsRecorded =
            getText( container, ELEMENTS_RECORDED, true );
        String pubLevelTxt = getText( container, PUBLICATION_LEVEL, true );
        Long pubDate = AttributeIo.getValue( "read", PUBLICATION_DATE,
                                             AttributeIo
                                            .getGlobal( container, "read",
                                                        PUBLICATION_DATE, 0 ),
                                             DataType.TIME_TT2000,
                                             Long.class, true );
        String observatoryName = getText( container, OBSERVATORY_NAME, true );
        double latitude = getDouble( container, LATITUDE );
        double longitude = getDouble( container, LONGITUDE );
        double elevation = getDouble( container, ELEVATION );
        String institution = getText( container, INSTITUTION, true );
        String vectorSensOrient =
            getText( container, VECTOR_SENS_ORIENT, false );
        String standardLevelTxt = getText( container, STANDARD_LEVEL, true );
        String standardName = getText( container, STANDARD_NAME, false );
        String standardVersion = getText( container, STANDARD_VERSION, false );
        String partialStandDesc =
            getText( container, PARTIAL_STAND_DESC, false );
        String source = getText( container, SOURCE, true );
        String termsOfUse = getText( container, TERMS_OF_USE, false );
        String uniqueIdentifier =
            getText( container, UNIQUE_IDENTIFIER, false );
        List<String> parentIdentifiers =
            getEntries( container, PARENT_IDENTIFIERS );
        List<String> referenceLinks = getEntries( container, REFERENCE_LINKS );

        PublicationLevel pubLevel = PublicationLevel.fromCode( pubLevelTxt );
        if ( pubLevel == null ) {
            throw invalid( PUBLICATION_LEVEL, "unknown publication level \""
                                            + pubLevelTxt + "\"" );
        }
        StandardLevel standardLevel = StandardLevel.fromCode( standardLevelTxt );
        if ( standardLevel == null ) {
            throw invalid( STANDARD_LEVEL, "unknown standard level \""
                                         + standardLevelTxt + "\"" );
        }

        Metadata md = new Metadata();
        md.setFormatDescription( formatDescription );
        md.setFormatVersion( formatVersion );
        md.setTitle( title );
        md.setIagaCode( iagaCode );
        md.setElementsRecorded( elementsRecorded );
        md.setPublicationLevel( pubLevel );
        md.setPublicationDate( pubDate.longValue() );
        md.setObservatoryName( observatoryName );
        md.setLatitude( latitude );
        md.setLongitude( longitude );
        md.setElevation( elevation );
        md.setInstitution( institution );
        md.setVectorSensOrient( vectorSensOrient );
        md.setStandardLevel( standardLevel );
        md.setStandardName( standardName );
        md.setStandardVersion( standardVersion );
        md.setPartialStandDesc( partialStandDesc );
        md.setSource( source );
        md.setTermsOfUse( termsOfUse );
        md.setUniqueIdentifier( uniqueIdentifier );
        md.setParentIdentifiers( parentIdentifiers );
        md.setReferenceLinks( referenceLinks );
        validate( md );
        logger_.config( "Read ImagCDF metadata for " + iagaCode
                      + ", elements " + elementsRecorded );
        return md;
    }

    /**
     * Checks the title, format description and format version against
     * the values this library understands.
     * Title and description are compared ignoring case.
     *
     * @param  metadata  metadata to check
     * @throws ImagCdfException  with kind VALIDATION on failure
     */
    public static void validate( Metadata metadata ) throws ImagCdfException {
        if ( ! CANONICAL_TITLE.equalsIgnoreCase( metadata.getTitle() ) ) {
            throw invalid( TITLE, "title of data incorrect: \""
                                + metadata.getTitle() + "\"" );
        }
        if ( ! CANONICAL_DESCRIPTION
              .equalsIgnoreCase( metadata.getFormatDescription() ) ) {
            throw invalid( FORMAT_DESCRIPTION,
                           "description of data incorrect: \""
                         + metadata.getFormatDescription() + "\"" );
        }
        int version = parseFormatVersion( metadata.getFormatVersion() );
        if ( version < MIN_FORMAT_VERSION || version > MAX_FORMAT_VERSION ) {
            throw invalid( FORMAT_VERSION, "unsupported format version \""
                                         + metadata.getFormatVersion()
                                         + "\"" );
        }
    }

    /**
     * Parses a format version string of the form "major.minor",
     * where minor is a single digit.
     *
     * @param  version  version string, for instance "1.3"
     * @return  version in tenths, for instance 13, or -1 if the string
     *          cannot be parsed
     */
    public static int parseFormatVersion( String version ) {
        if ( version == null ) {
            return -1;
        }
        String txt = version.trim();
        int idot = txt.indexOf( '.' );
        if ( idot < 1 || idot != txt.length() - 2 ) {
            return -1;
        }
        String major = txt.substring( 0, idot );
        char minor = txt.charAt( idot + 1 );
        if ( minor < '0' || minor > '9' ) {
            return -1;
        }
        for ( int i = 0; i < major.length(); i++ ) {
            char c = major.charAt( i );
            if ( c < '0' || c > '9' ) {
                return -1;
            }
        }
        try {
            return Integer.parseInt( major ) * 10 + ( minor - '0' );
        }
        catch ( NumberFormatException e ) {
            return -1;
        }
    }

    /**
     * Returns the standard INTERMAGNET conditions of use, written as
     * the TermsOfUse when none is given.
     *
     * @return  licence text
     */
    public static String getTermsOfUse() {
        return TERMS_OF_USE_TEXT;
    }

    /**
     * Returns a copy of some metadata with blank title, format description,
     * format version and terms of use replaced by defaults.
     *
     * @param  metadata  input metadata
     * @return  new metadata
     */
    private static Metadata applyDefaults( Metadata metadata ) {
        Metadata md = new Metadata( metadata );
        if ( AttributeIo.isBlank( md.getTitle() ) ) {
            md.setTitle( CANONICAL_TITLE );
        }
        if ( AttributeIo.isBlank( md.getFormatDescription() ) ) {
            md.setFormatDescription( CANONICAL_DESCRIPTION );
        }
        if ( AttributeIo.isBlank( md.getFormatVersion() ) ) {
            md.setFormatVersion( DEFAULT_FORMAT_VERSION );
        }
        if ( AttributeIo.isBlank( md.getTermsOfUse() ) ) {
            md.setTermsOfUse( TERMS_OF_USE_TEXT );
        }
        return md;
    }

    /**
     * Checks that the properties with no default are present.
     *
     * @param  md  metadata
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if not
     */
    private static void checkRequired( Metadata md ) throws ImagCdfException {
        requireValue( IAGA_CODE, md.getIagaCode() );
        requireValue( ELEMENTS_RECORDED, md.getElementsRecorded() );
        requireValue( PUBLICATION_LEVEL, md.getPublicationLevel() );
        requireValue( OBSERVATORY_NAME, md.getObservatoryName() );
        requireValue( INSTITUTION, md.getInstitution() );
        requireValue( STANDARD_LEVEL, md.getStandardLevel() );
        requireValue( SOURCE, md.getSource() );
        for ( String id : md.getParentIdentifiers() ) {
            requireValue( PARENT_IDENTIFIERS, id );
        }
        for ( String link : md.getReferenceLinks() ) {
            requireValue( REFERENCE_LINKS, link );
        }
    }

    private static void requireValue( String attName, Object value )
            throws ImagCdfException {
        if ( value == null ) {
            throw new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                        ImagCdfException
                                       .formatMessage( "write", attName,
                                                       null )
                                      + ": no value" );
        }
    }

    /**
     * Checks that writing metadata will not leave entries from earlier
     * metadata in place.
     */
    private static void checkOverwrite( CdfContainer container,
                                        Metadata md )
            throws ImagCdfException {
        checkNoEntry( container, VECTOR_SENS_ORIENT,
                      countEntries( md.getVectorSensOrient() ) );
        checkNoEntry( container, STANDARD_NAME,
                      countEntries( md.getStandardName() ) );
        checkNoEntry( container, STANDARD_VERSION,
                      countEntries( md.getStandardVersion() ) );
        checkNoEntry( container, PARTIAL_STAND_DESC,
                      countEntries( md.getPartialStandDesc() ) );
        checkNoEntry( container, UNIQUE_IDENTIFIER,
                      countEntries( md.getUniqueIdentifier() ) );
        checkNoEntry( container, PARENT_IDENTIFIERS,
                      md.getParentIdentifiers().size() );
        checkNoEntry( container, REFERENCE_LINKS,
                      md.getReferenceLinks().size() );
    }

    private static int countEntries( String value ) {
        return AttributeIo.isBlank( value ) ? 0 : 1;
    }

    /**
     * Fails if an attribute already has an entry at the first index
     * that is not about to be written.
     */
    private static void checkNoEntry( CdfContainer container, String attName,
                                      int nwrite )
            throws ImagCdfException {
        if ( AttributeIo.getGlobal( container, "write", attName, nwrite )
             != null ) {
            throw new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                        ImagCdfException
                                       .formatMessage( "write", attName,
                                                       null )
                                      + ": entry " + nwrite
                                      + " already present" );
        }
    }

    private static void putText( CdfContainer container, String attName,
                                 String value )
            throws ImagCdfException {
        AttributeIo.putGlobal( container, "write", attName, 0,
                               AttributeEntry.createText( value ) );
    }

    private static void putOptionalText( CdfContainer container,
                                         String attName, String value )
            throws ImagCdfException {
        if ( ! AttributeIo.isBlank( value ) ) {
            putText( container, attName, value );
        }
    }

    private static void putDouble( CdfContainer container, String attName,
                                   double value )
            throws ImagCdfException {
        AttributeIo.putGlobal( container, "write", attName, 0,
                               AttributeEntry.createDouble( value ) );
    }

    /**
     * Writes a list of strings as successive entries of one attribute.
     */
    private static void putEntries( CdfContainer container, String attName,
                                    List<String> values )
            throws ImagCdfException {
        for ( int ie = 0; ie < values.size(); ie++ ) {
            AttributeIo.putGlobal( container, "write", attName, ie,
                                   AttributeEntry
                                  .createText( values.get( ie ) ) );
        }
    }

    private static String getText( CdfContainer container, String attName,
                                   boolean required )
            throws ImagCdfException {
        AttributeEntry entry =
            AttributeIo.getGlobal( container, "read", attName, 0 );
        return AttributeIo.getValue( "read", attName, entry, DataType.CHAR,
                                     String.class, required );
    }

    private static double getDouble( CdfContainer container, String attName )
            throws ImagCdfException {
        AttributeEntry entry =
            AttributeIo.getGlobal( container, "read", attName, 0 );
        return AttributeIo.getValue( "read", attName, entry, DataType.DOUBLE,
                                     Double.class, true ).doubleValue();
    }

    /**
     * Reads successive entries of a text attribute, starting at entry 0,
     * until one is absent.
     */
    private static List<String> getEntries( CdfContainer container,
                                            String attName )
            throws ImagCdfException {
        List<String> list = new ArrayList<String>();
        for ( int ie = 0; ; ie++ ) {
            AttributeEntry entry =
                AttributeIo.getGlobal( container, "read", attName, ie );
            if ( entry == null ) {
                return list;
            }
            list.add( AttributeIo.getValue( "read", attName + "[" + ie + "]",
                                            entry, DataType.CHAR,
                                            String.class, true ) );
        }
    }

    private static ImagCdfException invalid( String attName, String msg ) {
        return new ImagCdfException( ImagCdfException.Kind.VALIDATION,
                                     ImagCdfException
                                    .formatMessage( "validate", attName, null )
                                   + ": " + msg );
    }
}
