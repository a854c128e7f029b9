package io.github.mandar2812.imagcdf.container;

/**
 * Status report from a container operation.
 * Codes follow the CDF library convention: zero is success,
 * positive values are informational, values between
 * {@link #WARN_LIMIT} and zero are warnings, and values below
 * {@link #WARN_LIMIT} are errors.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class CdfStatus {

    private final int code_;
    private final String text_;

    /** Codes below this value denote errors. */
    public static final int WARN_LIMIT = -2000;

    /** Successful completion. */
    public static final CdfStatus OK = new CdfStatus( 0, "Success" );

    /**
     * Constructor.
     *
     * @param  code  status code
     * @param  text  short explanation as supplied by the container engine
     */
    public CdfStatus( int code, String text ) {
        code_ = code;
        text_ = text;
    }

    /**
     * Returns the status code.
     *
     * @return  code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns the engine's explanatory text for this status.
     *
     * @return  status text
     */
    public String getText() {
        return text_;
    }

    /**
     * Indicates whether this status represents an error.
     *
     * @return  true for error codes
     */
    public boolean isError() {
        return code_ < WARN_LIMIT;
    }

    /**
     * Indicates whether this status represents a warning.
     *
     * @return  true for warning codes
     */
    public boolean isWarning() {
        return code_ >= WARN_LIMIT && code_ < 0;
    }

    /**
     * Renders this status for display to a user, prefixed by its severity.
     *
     * @return  "Error: ...", "Warning: ...", "Information: ..." or "Success"
     */
    public String toMessage() {
        if ( isError() ) {
            return "Error: " + text_;
        }
        else if ( isWarning() ) {
            return "Warning: " + text_;
        }
        else if ( code_ > 0 ) {
            return "Information: " + text_;
        }
        else {
            return "Success";
        }
    }

    @Override
    public boolean equals( Object o ) {
        if ( o instanceof CdfStatus ) {
            CdfStatus other = (CdfStatus) o;
            return other.code_ == code_ && other.text_.equals( text_ );
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return code_ * 23 + text_.hashCode();
    }

    @Override
    public String toString() {
        return code_ + " " + text_;
    }
}
