package io.github.mandar2812.imagcdf.container;

import java.util.SortedMap;
import java.util.TreeMap;

import io.github.mandar2812.imagcdf.AttributeEntry;

/**
 * Holds the name and entry values of a CDF attribute with global scope.
 * Entries are addressed by number and may be sparse.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class GlobalAttribute {

    private final String name_;
    private final SortedMap<Integer,AttributeEntry> entries_;

    /**
     * Constructor.
     *
     * @param   name   attribute name
     */
    public GlobalAttribute( String name ) {
        name_ = name;
        entries_ = new TreeMap<Integer,AttributeEntry>();
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
     * Returns an entry value.
     *
     * @param  entryNum  entry index
     * @return  entry, or null if there is none with that index
     */
    public AttributeEntry getEntry( int entryNum ) {
        return entries_.get( Integer.valueOf( entryNum ) );
    }

    /**
     * Sets an entry value.
     *
     * @param  entryNum  entry index
     * @param  entry   entry value
     */
    public void setEntry( int entryNum, AttributeEntry entry ) {
        entries_.put( Integer.valueOf( entryNum ), entry );
    }

    /**
     * Returns the highest entry index in use.
     *
     * @return  max entry index, or -1 if there are no entries
     */
    public int getMaxEntry() {
        return entries_.isEmpty() ? -1 : entries_.lastKey().intValue();
    }
}
