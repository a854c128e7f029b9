package io.github.mandar2812.imagcdf;

/**
 * One measured channel of an ImagCDF dataset: a geomagnetic field
 * element or a temperature, with its samples and descriptive attributes.
 * Instances are immutable.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class Variable {

    private final VariableType type_;
    private final String code_;
    private final String fieldName_;
    private final String units_;
    private final double fillValue_;
    private final double validMin_;
    private final double validMax_;
    private final String depend0_;
    private final double[] data_;

    /** Canonical value for missing samples. */
    public static final double FILL_VALUE = 99999.0;

    /**
     * Constructor.
     *
     * @param  type   variable type
     * @param  code   element code: a letter such as "H" for field
     *                elements, a channel number such as "1" for
     *                temperatures
     * @param  fieldName  descriptive name (FIELDNAM)
     * @param  units   physical units (UNITS)
     * @param  fillValue  value marking missing samples (FILLVAL)
     * @param  validMin   smallest valid sample value (VALIDMIN)
     * @param  validMax   largest valid sample value (VALIDMAX)
     * @param  depend0  name of the time series the samples are indexed
     *                  against, or null to have it derived on write
     * @param  data    sample values; the array is copied
     */
    public Variable( VariableType type, String code, String fieldName,
                     String units, double fillValue, double validMin,
                     double validMax, String depend0, double[] data ) {
        type_ = type;
        code_ = code;
        fieldName_ = fieldName;
        units_ = units;
        fillValue_ = fillValue;
        validMin_ = validMin;
        validMax_ = validMax;
        depend0_ = depend0;
        data_ = data == null ? new double[ 0 ] : data.clone();
    }

    public VariableType getType() {
        return type_;
    }

    public String getCode() {
        return code_;
    }

    public String getFieldName() {
        return fieldName_;
    }

    public String getUnits() {
        return units_;
    }

    public double getFillValue() {
        return fillValue_;
    }

    public double getValidMin() {
        return validMin_;
    }

    public double getValidMax() {
        return validMax_;
    }

    /**
     * Returns the name of the time series that this variable's samples
     * are indexed against.
     *
     * @return  DEPEND_0 value, or null if not set
     */
    public String getDepend0() {
        return depend0_;
    }

    /**
     * Returns a copy of the sample values.
     *
     * @return  new array
     */
    public double[] getData() {
        return data_.clone();
    }

    /**
     * Returns the number of samples.
     *
     * @return  data length
     */
    public int getDataLength() {
        return data_.length;
    }

    /**
     * Indicates whether a sample is missing, that is equal to
     * this variable's fill value.
     *
     * @param  index  sample index
     * @return  true iff the sample is a fill value
     */
    public boolean isFill( int index ) {
        return data_[ index ] == fillValue_;
    }

    @Override
    public String toString() {
        return type_ + " " + code_ + " (" + data_.length + " samples)";
    }
}
