package io.github.mandar2812.imagcdf;

/**
 * Degree to which a dataset conforms to the standard named in its
 * StandardName attribute.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum StandardLevel {
    FULL( "Full" ),
    PARTIAL( "Partial" ),
    NONE( "None" );

    private final String code_;

    /**
     * Constructor.
     *
     * @param  code  attribute value
     */
    StandardLevel( String code ) {
        code_ = code;
    }

    /**
     * Returns the value stored in the StandardLevel attribute.
     *
     * @return  "Full", "Partial" or "None"
     */
    public String getCode() {
        return code_;
    }

    /**
     * Returns the level for a given attribute value, ignoring case.
     *
     * @param  code  attribute value
     * @return  level, or null if the value is not recognised
     */
    public static StandardLevel fromCode( String code ) {
        if ( code != null ) {
            String trimmed = code.trim();
            for ( StandardLevel level : values() ) {
                if ( level.code_.equalsIgnoreCase( trimmed ) ) {
                    return level;
                }
            }
        }
        return null;
    }
}
