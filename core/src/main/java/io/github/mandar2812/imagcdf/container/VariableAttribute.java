package io.github.mandar2812.imagcdf.container;

import java.util.LinkedHashMap;
import java.util.Map;

import io.github.mandar2812.imagcdf.AttributeEntry;

/**
 * Holds the name and per-variable entry values
 * of a CDF attribute with variable scope.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class VariableAttribute {

    private final String name_;
    private final Map<String,AttributeEntry> entries_;

    /**
     * Constructor.
     *
     * @param  name  attribute name
     */
    public VariableAttribute( String name ) {
        name_ = name;
        entries_ = new LinkedHashMap<String,AttributeEntry>();
    }

    /**
     * Returns this attribute's name.
     *
     * @return   attribute name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the entry value that a given variable has for this attribute.
     * If the variable has no entry for this attribute, null is returned.
     *
     * @param  varName  variable name
     * @return   this attribute's value for the variable
     */
    public AttributeEntry getEntry( String varName ) {
        return entries_.get( varName );
    }

    /**
     * Sets the entry value for a given variable.
     *
     * @param  varName  variable name
     * @param  entry   entry value
     */
    public void setEntry( String varName, AttributeEntry entry ) {
        entries_.put( varName, entry );
    }
}
