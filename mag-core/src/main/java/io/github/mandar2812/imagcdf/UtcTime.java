package io.github.mandar2812.imagcdf;

/**
 * Broken-down UTC calendar time.
 * The second field may be 60 during an inserted leap second.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class UtcTime {

    private final int year_;
    private final int month_;
    private final int day_;
    private final int hour_;
    private final int minute_;
    private final int second_;
    private final int nanos_;

    /**
     * Constructor.
     *
     * @param  year   year AD
     * @param  month  month of year, 1-based
     * @param  day    day of month, 1-based
     * @param  hour   hour of day
     * @param  minute  minute of hour
     * @param  second  second of minute, 0-60
     * @param  nanos   nanoseconds into the second
     */
    public UtcTime( int year, int month, int day, int hour, int minute,
                    int second, int nanos ) {
        year_ = year;
        month_ = month;
        day_ = day;
        hour_ = hour;
        minute_ = minute;
        second_ = second;
        nanos_ = nanos;
    }

    public int getYear() {
        return year_;
    }

    public int getMonth() {
        return month_;
    }

    public int getDay() {
        return day_;
    }

    public int getHour() {
        return hour_;
    }

    public int getMinute() {
        return minute_;
    }

    public int getSecond() {
        return second_;
    }

    public int getNanos() {
        return nanos_;
    }

    /**
     * Returns a copy of this time with the nanosecond part removed.
     *
     * @return  time truncated to the second
     */
    public UtcTime truncateToSecond() {
        return nanos_ == 0
             ? this
             : new UtcTime( year_, month_, day_, hour_, minute_, second_, 0 );
    }

    @Override
    public boolean equals( Object o ) {
        if ( o instanceof UtcTime ) {
            UtcTime other = (UtcTime) o;
            return other.year_ == year_
                && other.month_ == month_
                && other.day_ == day_
                && other.hour_ == hour_
                && other.minute_ == minute_
                && other.second_ == second_
                && other.nanos_ == nanos_;
        }
        else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        int code = 55;
        code = 23 * code + year_;
        code = 23 * code + month_;
        code = 23 * code + day_;
        code = 23 * code + hour_;
        code = 23 * code + minute_;
        code = 23 * code + second_;
        code = 23 * code + nanos_;
        return code;
    }

    @Override
    public String toString() {
        return EpochFormatter.formatUtc( this, true );
    }
}
