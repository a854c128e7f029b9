package io.github.mandar2812.imagcdf;

/**
 * INTERMAGNET publication level of a dataset, describing how far its
 * data have been through review.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum PublicationLevel {

    /** Raw data, no quality control. */
    LEVEL_1( "1" ),

    /** Edited data, preliminary baselines. */
    LEVEL_2( "2" ),

    /** Ready for publication. */
    LEVEL_3( "3" ),

    /** Definitive data. */
    LEVEL_4( "4" );

    private final String code_;

    /**
     * Constructor.
     *
     * @param  code  attribute value
     */
    PublicationLevel( String code ) {
        code_ = code;
    }

    /**
     * Returns the value stored in the PublicationLevel attribute.
     *
     * @return  "1" to "4"
     */
    public String getCode() {
        return code_;
    }

    /**
     * Returns the level for a given attribute value.
     *
     * @param  code  attribute value
     * @return  level, or null if the value is not recognised
     */
    public static PublicationLevel fromCode( String code ) {
        if ( code != null ) {
            String trimmed = code.trim();
            for ( PublicationLevel level : values() ) {
                if ( level.code_.equals( trimmed ) ) {
                    return level;
                }
            }
        }
        return null;
    }

    /**
     * Maps an IAGA-2002 or IMF data type, in full or abbreviated form
     * ("R", "reported", "D", "definitive" etc.), to a publication level.
     * Only the first character is significant.
     * Unrecognised types give level 1.
     *
     * @param  dataType  data type string
     * @return  publication level, not null
     */
    public static PublicationLevel fromDataType( String dataType ) {
        if ( dataType == null || dataType.length() == 0 ) {
            return LEVEL_1;
        }
        switch ( Character.toUpperCase( dataType.charAt( 0 ) ) ) {
            case 'V':
            case 'R':
                return LEVEL_1;
            case 'P':
            case 'A':
                return LEVEL_2;
            case 'Q':
                return LEVEL_3;
            case 'D':
                return LEVEL_4;
            default:
                return LEVEL_1;
        }
    }
}
