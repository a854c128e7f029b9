package io.github.mandar2812.imagcdf.container;

import java.io.Closeable;
import java.io.IOException;

import io.github.mandar2812.imagcdf.AttributeEntry;
import io.github.mandar2812.imagcdf.DataType;

/**
 * Session on one open dataset of a CDF-like container engine.
 * This is the complete set of capabilities that the ImagCDF mapping
 * layer needs from the engine: global attributes addressed by
 * name and entry number, variable attributes addressed by attribute
 * and variable name, and record-varying scalar variables.
 *
 * <p>Absence is not a failure: the lookup methods return null
 * when the thing asked for does not exist.  Every other failure is
 * reported by throwing a {@link ContainerException}.
 * Each session records the status of its own most recent operation.
 *
 * <p>Implementations need not be thread-safe.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public interface CdfContainer extends Closeable {

    /**
     * Writes an entry of a global attribute, creating the attribute
     * if required.  An existing entry with the same number is replaced.
     *
     * @param  attName  attribute name
     * @param  entryNum  entry index, starting at 0
     * @param  entry   entry value
     */
    void putGlobalEntry( String attName, int entryNum, AttributeEntry entry )
            throws IOException;

    /**
     * Reads an entry of a global attribute.
     *
     * @param  attName  attribute name
     * @param  entryNum  entry index, starting at 0
     * @return  entry, or null if the attribute or entry does not exist
     */
    AttributeEntry getGlobalEntry( String attName, int entryNum )
            throws IOException;

    /**
     * Writes a variable attribute entry for a given variable,
     * creating the attribute if required.
     *
     * @param  attName  attribute name
     * @param  varName  name of an existing variable
     * @param  entry   entry value
     */
    void putVariableEntry( String attName, String varName,
                           AttributeEntry entry ) throws IOException;

    /**
     * Reads a variable attribute entry for a given variable.
     *
     * @param  attName  attribute name
     * @param  varName  variable name
     * @return  entry, or null if the attribute or entry does not exist
     * @throws ContainerException  if the variable does not exist
     */
    AttributeEntry getVariableEntry( String attName, String varName )
            throws IOException;

    /**
     * Creates a record-varying scalar variable.
     *
     * @param  varName  variable name
     * @param  dataType  DOUBLE or TIME_TT2000
     * @return  true if the variable was created,
     *          false if a variable of that name already existed
     */
    boolean createVariable( String varName, DataType dataType )
            throws IOException;

    /**
     * Returns a description of a variable.
     *
     * @param  varName  variable name
     * @return  variable description, or null if no such variable exists
     */
    VariableInfo getVariableInfo( String varName ) throws IOException;

    /**
     * Indicates whether a variable exists.
     *
     * @param  varName  variable name
     * @return  true iff the variable exists
     */
    boolean hasVariable( String varName ) throws IOException;

    /**
     * Writes a run of records to a variable.
     *
     * @param  varName  name of an existing variable
     * @param  firstRecord  index of the first record to write
     * @param  values   array of the variable's type
     *                  (see {@link DataType#getArrayClass}),
     *                  one element per record
     */
    void putRecords( String varName, long firstRecord, Object values )
            throws IOException;

    /**
     * Reads all the records of a variable, from 0 to the highest
     * record written.
     *
     * @param  varName  name of an existing variable
     * @return  new array of the variable's type, one element per record
     */
    Object readRecords( String varName ) throws IOException;

    /**
     * Returns the status of the most recent operation on this session.
     *
     * @return  last status
     */
    CdfStatus getLastStatus();

    /**
     * Finishes with this session.  After writing, this must be called
     * for the dataset to be complete.
     */
    void close() throws IOException;
}
