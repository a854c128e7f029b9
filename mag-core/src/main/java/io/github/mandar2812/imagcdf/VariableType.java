package io.github.mandar2812.imagcdf;

/**
 * Kind of quantity held by an ImagCDF data variable.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum VariableType {

    /** Geomagnetic field component or scalar intensity. */
    GEOMAGNETIC_FIELD_ELEMENT( "GeomagneticFieldElement",
                               "GeomagneticField" ),

    /** Temperature channel, with a numeric element code. */
    TEMPERATURE( "Temperature", "Temperature" );

    private final String name_;
    private final String prefix_;

    /**
     * Constructor.
     *
     * @param  name  display name
     * @param  prefix  prefix of container variable names for this type
     */
    VariableType( String name, String prefix ) {
        name_ = name;
        prefix_ = prefix;
    }

    /**
     * Returns the display name of this type.
     *
     * @return  "GeomagneticFieldElement" or "Temperature"
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the string which, followed by an element code, makes
     * the name of a container variable of this type.
     *
     * @return  "GeomagneticField" or "Temperature"
     */
    public String getPrefix() {
        return prefix_;
    }

    /**
     * Returns the type with a given display name, ignoring case.
     *
     * @param  name  display name
     * @return  type, or null if not recognised
     */
    public static VariableType fromName( String name ) {
        for ( VariableType type : values() ) {
            if ( type.name_.equalsIgnoreCase( name ) ) {
                return type;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name_;
    }
}
