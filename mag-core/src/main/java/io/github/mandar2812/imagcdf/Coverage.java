package io.github.mandar2812.imagcdf;

/**
 * Time span covered by one ImagCDF file.
 * This fixes the precision of the date in the file name.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum Coverage {
    ANNUAL,
    MONTHLY,
    DAILY,
    HOURLY,
    MINUTE,
    SECOND;

    /**
     * Returns the coverage whose date precision matches a cadence,
     * so that consecutive samples fall in consecutive file names.
     *
     * @param  cadence  sampling cadence
     * @return  file coverage; SECOND for an unknown cadence
     */
    public static Coverage forCadence( Cadence cadence ) {
        switch ( cadence ) {
            case ANNUAL:
                return ANNUAL;
            case MONTHLY:
                return MONTHLY;
            case DAILY:
                return DAILY;
            case HOURLY:
                return HOURLY;
            case MINUTE:
                return MINUTE;
            default:
                return SECOND;
        }
    }
}
