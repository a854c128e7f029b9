package io.github.mandar2812.imagcdf.container;

import io.github.mandar2812.imagcdf.DataType;

/**
 * Describes a record-varying variable held in a container.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class VariableInfo {

    private final String name_;
    private final DataType dataType_;
    private final int numDims_;
    private final long maxRecord_;

    /**
     * Constructor.
     *
     * @param  name   variable name
     * @param  dataType  data type of each record
     * @param  numDims   number of dimensions of each record (0 for scalar)
     * @param  maxRecord  index of the highest record written, or -1 if none
     */
    public VariableInfo( String name, DataType dataType, int numDims,
                         long maxRecord ) {
        name_ = name;
        dataType_ = dataType;
        numDims_ = numDims;
        maxRecord_ = maxRecord;
    }

    /**
     * Returns the variable name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the data type of the records.
     *
     * @return  data type
     */
    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the record dimensionality.
     *
     * @return  number of dimensions, 0 for a scalar per record
     */
    public int getNumDims() {
        return numDims_;
    }

    /**
     * Returns the highest record index written.
     *
     * @return  max record index, or -1 for a variable with no records
     */
    public long getMaxRecord() {
        return maxRecord_;
    }

    /**
     * Returns the number of records, including any unwritten
     * records before the highest written one.
     *
     * @return  max record + 1
     */
    public long getRecordCount() {
        return maxRecord_ + 1;
    }

    @Override
    public String toString() {
        return name_ + " " + dataType_ + " " + numDims_ + ":"
             + getRecordCount();
    }
}
