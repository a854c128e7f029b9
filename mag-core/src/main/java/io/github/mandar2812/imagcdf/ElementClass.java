package io.github.mandar2812.imagcdf;

/**
 * Classification of a data variable by its type and element code.
 * The class decides which time series a variable is indexed against.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum ElementClass {

    /** Vector field component: X, Y, Z, H, D, E, V, I or F. */
    VECTOR,

    /** Independent scalar measurement: S or G. */
    SCALAR,

    /** Temperature channel. */
    TEMPERATURE;

    private static final String VECTOR_CODES = "XYZHDEVIF";
    private static final String SCALAR_CODES = "SG";

    /**
     * Classifies a variable.
     * For geomagnetic elements only the first character of the code
     * counts, case-insensitively.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  class, or null if the code names no known element
     */
    public static ElementClass classify( VariableType type, String code ) {
        if ( type == VariableType.TEMPERATURE ) {
            return TEMPERATURE;
        }
        else if ( type == VariableType.GEOMAGNETIC_FIELD_ELEMENT &&
                  code != null && code.length() > 0 ) {
            char c = Character.toUpperCase( code.charAt( 0 ) );
            if ( VECTOR_CODES.indexOf( c ) >= 0 ) {
                return VECTOR;
            }
            else if ( SCALAR_CODES.indexOf( c ) >= 0 ) {
                return SCALAR;
            }
        }
        return null;
    }

    /**
     * Indicates whether a variable holds a vector field component.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  true only for geomagnetic vector elements
     */
    public static boolean isVector( VariableType type, String code ) {
        return classify( type, code ) == VECTOR;
    }

    /**
     * Indicates whether a variable holds a scalar field measurement.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  true only for geomagnetic scalar elements
     */
    public static boolean isScalar( VariableType type, String code ) {
        return classify( type, code ) == SCALAR;
    }
}
