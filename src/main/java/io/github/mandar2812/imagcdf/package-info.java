/**
 * Pure java mapping between INTERMAGNET geomagnetic observatory data
 * and the ImagCDF layout of a CDF-like container.
 *
 * <p>To write a dataset, describe it with a
 * {@link io.github.mandar2812.imagcdf.Metadata} object, one or more
 * {@link io.github.mandar2812.imagcdf.Variable}s and their
 * {@link io.github.mandar2812.imagcdf.TimeSeries}, and pass them to an
 * {@link io.github.mandar2812.imagcdf.ImagCdfWriter}.
 * To read one back, use the
 * {@link io.github.mandar2812.imagcdf.ImagCdfContent} class.
 * The codec classes give finer grained access to single attributes,
 * variables and series.
 *
 * <p>The container itself is reached through the
 * {@link io.github.mandar2812.imagcdf.container.CdfContainer} interface;
 * an in-memory implementation is provided.
 * Times are TT2000 values, handled by
 * {@link io.github.mandar2812.imagcdf.Tt2000}.
 */
package io.github.mandar2812.imagcdf;
