package io.github.mandar2812.imagcdf;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dataset-level metadata of an ImagCDF dataset, held in its
 * global attributes.
 *
 * <p>Instances are built up by setter calls before a write, or fully
 * populated by {@link MetadataCodec#read}.
 * List-valued properties are copied on the way in and out.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class Metadata {

    private String formatDescription_;
    private String formatVersion_;
    private String title_;
    private String iagaCode_;
    private String elementsRecorded_;
    private PublicationLevel publicationLevel_;
    private long publicationDate_;
    private String observatoryName_;
    private double latitude_;
    private double longitude_;
    private double elevation_;
    private String institution_;
    private String vectorSensOrient_;
    private StandardLevel standardLevel_;
    private String standardName_;
    private String standardVersion_;
    private String partialStandDesc_;
    private String source_;
    private String termsOfUse_;
    private String uniqueIdentifier_;
    private List<String> parentIdentifiers_;
    private List<String> referenceLinks_;

    /**
     * Constructs an empty metadata object.
     */
    public Metadata() {
        parentIdentifiers_ = new ArrayList<String>();
        referenceLinks_ = new ArrayList<String>();
    }

    /**
     * Copy constructor.
     *
     * @param  other  metadata to copy
     */
    public Metadata( Metadata other ) {
        formatDescription_ = other.formatDescription_;
        formatVersion_ = other.formatVersion_;
        title_ = other.title_;
        iagaCode_ = other.iagaCode_;
        elementsRecorded_ = other.elementsRecorded_;
        publicationLevel_ = other.publicationLevel_;
        publicationDate_ = other.publicationDate_;
        observatoryName_ = other.observatoryName_;
        latitude_ = other.latitude_;
        longitude_ = other.longitude_;
        elevation_ = other.elevation_;
        institution_ = other.institution_;
        vectorSensOrient_ = other.vectorSensOrient_;
        standardLevel_ = other.standardLevel_;
        standardName_ = other.standardName_;
        standardVersion_ = other.standardVersion_;
        partialStandDesc_ = other.partialStandDesc_;
        source_ = other.source_;
        termsOfUse_ = other.termsOfUse_;
        uniqueIdentifier_ = other.uniqueIdentifier_;
        parentIdentifiers_ = new ArrayList<String>( other.parentIdentifiers_ );
        referenceLinks_ = new ArrayList<String>( other.referenceLinks_ );
    }

    public String getFormatDescription() {
        return formatDescription_;
    }

    public void setFormatDescription( String formatDescription ) {
        formatDescription_ = formatDescription;
    }

    /**
     * Returns the format version string, for instance "1.3".
     *
     * @return  format version
     */
    public String getFormatVersion() {
        return formatVersion_;
    }

    public void setFormatVersion( String formatVersion ) {
        formatVersion_ = formatVersion;
    }

    public String getTitle() {
        return title_;
    }

    public void setTitle( String title ) {
        title_ = title;
    }

    public String getIagaCode() {
        return iagaCode_;
    }

    public void setIagaCode( String iagaCode ) {
        iagaCode_ = iagaCode;
    }

    /**
     * Returns the concatenated codes of the recorded elements,
     * for instance "HDZS".  Order is significant.
     *
     * @return  elements recorded
     */
    public String getElementsRecorded() {
        return elementsRecorded_;
    }

    public void setElementsRecorded( String elementsRecorded ) {
        elementsRecorded_ = elementsRecorded;
    }

    /**
     * Returns the recorded element codes, one per character of
     * the ElementsRecorded value.
     *
     * @return  array of single-character codes, empty if none
     */
    public String[] getElements() {
        if ( elementsRecorded_ == null ) {
            return new String[ 0 ];
        }
        String[] codes = new String[ elementsRecorded_.length() ];
        for ( int i = 0; i < codes.length; i++ ) {
            codes[ i ] = elementsRecorded_.substring( i, i + 1 );
        }
        return codes;
    }

    public PublicationLevel getPublicationLevel() {
        return publicationLevel_;
    }

    public void setPublicationLevel( PublicationLevel publicationLevel ) {
        publicationLevel_ = publicationLevel;
    }

    /**
     * Returns the publication date.
     *
     * @return  TT2000 value
     */
    public long getPublicationDate() {
        return publicationDate_;
    }

    public void setPublicationDate( long publicationDate ) {
        publicationDate_ = publicationDate;
    }

    public String getObservatoryName() {
        return observatoryName_;
    }

    public void setObservatoryName( String observatoryName ) {
        observatoryName_ = observatoryName;
    }

    /**
     * Returns the geographic latitude.
     *
     * @return  latitude in degrees
     */
    public double getLatitude() {
        return latitude_;
    }

    public void setLatitude( double latitude ) {
        latitude_ = latitude;
    }

    /**
     * Returns the geographic longitude.
     *
     * @return  longitude in degrees
     */
    public double getLongitude() {
        return longitude_;
    }

    public void setLongitude( double longitude ) {
        longitude_ = longitude;
    }

    /**
     * Returns the elevation.
     *
     * @return  elevation in metres
     */
    public double getElevation() {
        return elevation_;
    }

    public void setElevation( double elevation ) {
        elevation_ = elevation;
    }

    public String getInstitution() {
        return institution_;
    }

    public void setInstitution( String institution ) {
        institution_ = institution;
    }

    public String getVectorSensOrient() {
        return vectorSensOrient_;
    }

    public void setVectorSensOrient( String vectorSensOrient ) {
        vectorSensOrient_ = vectorSensOrient;
    }

    public StandardLevel getStandardLevel() {
        return standardLevel_;
    }

    public void setStandardLevel( StandardLevel standardLevel ) {
        standardLevel_ = standardLevel;
    }

    public String getStandardName() {
        return standardName_;
    }

    public void setStandardName( String standardName ) {
        standardName_ = standardName;
    }

    public String getStandardVersion() {
        return standardVersion_;
    }

    public void setStandardVersion( String standardVersion ) {
        standardVersion_ = standardVersion;
    }

    public String getPartialStandDesc() {
        return partialStandDesc_;
    }

    public void setPartialStandDesc( String partialStandDesc ) {
        partialStandDesc_ = partialStandDesc;
    }

    public String getSource() {
        return source_;
    }

    public void setSource( String source ) {
        source_ = source;
    }

    public String getTermsOfUse() {
        return termsOfUse_;
    }

    public void setTermsOfUse( String termsOfUse ) {
        termsOfUse_ = termsOfUse;
    }

    public String getUniqueIdentifier() {
        return uniqueIdentifier_;
    }

    public void setUniqueIdentifier( String uniqueIdentifier ) {
        uniqueIdentifier_ = uniqueIdentifier;
    }

    /**
     * Returns the parent identifiers.
     *
     * @return  unmodifiable copy, possibly empty
     */
    public List<String> getParentIdentifiers() {
        return Collections.unmodifiableList(
                   new ArrayList<String>( parentIdentifiers_ ) );
    }

    public void setParentIdentifiers( List<String> parentIdentifiers ) {
        parentIdentifiers_ = parentIdentifiers == null
                           ? new ArrayList<String>()
                           : new ArrayList<String>( parentIdentifiers );
    }

    /**
     * Returns the reference links.
     *
     * @return  unmodifiable copy, possibly empty
     */
    public List<String> getReferenceLinks() {
        return Collections.unmodifiableList(
                   new ArrayList<String>( referenceLinks_ ) );
    }

    public void setReferenceLinks( List<String> referenceLinks ) {
        referenceLinks_ = referenceLinks == null
                        ? new ArrayList<String>()
                        : new ArrayList<String>( referenceLinks );
    }

    @Override
    public boolean equals( Object o ) {
        if ( ! ( o instanceof Metadata ) ) {
            return false;
        }
        Metadata other = (Metadata) o;
        return Arrays.equals( getComparisonKey(), other.getComparisonKey() );
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode( getComparisonKey() );
    }

    @Override
    public String toString() {
        return "ImagCDF " + iagaCode_ + " " + elementsRecorded_
             + " level " + ( publicationLevel_ == null
                                 ? null
                                 : publicationLevel_.getCode() );
    }

    /**
     * Returns an array of all the property values, for comparison.
     *
     * @return  property values
     */
    private Object[] getComparisonKey() {
        return new Object[] {
            formatDescription_, formatVersion_, title_, iagaCode_,
            elementsRecorded_, publicationLevel_,
            Long.valueOf( publicationDate_ ), observatoryName_,
            Double.valueOf( latitude_ ), Double.valueOf( longitude_ ),
            Double.valueOf( elevation_ ), institution_, vectorSensOrient_,
            standardLevel_, standardName_, standardVersion_,
            partialStandDesc_, source_, termsOfUse_, uniqueIdentifier_,
            parentIdentifiers_, referenceLinks_,
        };
    }
}
