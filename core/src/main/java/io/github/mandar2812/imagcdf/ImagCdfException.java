package io.github.mandar2812.imagcdf;

import java.io.IOException;

import io.github.mandar2812.imagcdf.container.CdfStatus;
import io.github.mandar2812.imagcdf.container.ContainerException;

/**
 * Exception thrown by the ImagCDF mapping layer.
 * Every failure has a {@link Kind}, so that callers can tell a missing
 * entry from a malformed one, and a message naming the operation and
 * the attribute or variable concerned.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class ImagCdfException extends IOException {

    private final Kind kind_;
    private final CdfStatus status_;

    /**
     * Constructor.
     *
     * @param  kind   failure category
     * @param  msg    message
     * @param  status  underlying container status, or null
     */
    public ImagCdfException( Kind kind, String msg, CdfStatus status ) {
        super( msg );
        kind_ = kind;
        status_ = status;
    }

    /**
     * Constructs an exception of a given kind with no container status.
     *
     * @param  kind  failure category
     * @param  msg   message
     */
    public ImagCdfException( Kind kind, String msg ) {
        this( kind, msg, null );
    }

    /**
     * Returns the category of this failure.
     *
     * @return  kind
     */
    public Kind getKind() {
        return kind_;
    }

    /**
     * Returns the container status associated with this failure, if any.
     *
     * @return  status, or null
     */
    public CdfStatus getStatus() {
        return status_;
    }

    /**
     * Indicates whether this exception reports an absent attribute,
     * entry, variable or time series.
     *
     * @return  true iff kind is NOT_FOUND
     */
    public boolean isNotFound() {
        return kind_ == Kind.NOT_FOUND;
    }

    /**
     * Translates a failure reported by the container engine.
     *
     * @param  operation  operation label
     * @param  param   name of the attribute or variable being handled
     * @param  cause   container exception
     * @return  new exception of kind COLLABORATOR
     */
    public static ImagCdfException fromContainer( String operation,
                                                  String param,
                                                  ContainerException cause ) {
        CdfStatus status = cause.getStatus();
        ImagCdfException e =
            new ImagCdfException( Kind.COLLABORATOR,
                                  formatMessage( operation, param, status ),
                                  status );
        e.initCause( cause );
        return e;
    }

    /**
     * Translates any I/O failure met while talking to the container.
     * Container exceptions keep their status; an ImagCdfException
     * is returned unchanged.
     *
     * @param  operation  operation label
     * @param  param   name of the attribute or variable being handled
     * @param  cause   exception thrown by the container
     * @return  exception to throw
     */
    public static ImagCdfException wrap( String operation, String param,
                                         IOException cause ) {
        if ( cause instanceof ImagCdfException ) {
            return (ImagCdfException) cause;
        }
        else if ( cause instanceof ContainerException ) {
            return fromContainer( operation, param,
                                  (ContainerException) cause );
        }
        else {
            ImagCdfException e =
                new ImagCdfException( Kind.COLLABORATOR,
                                      formatMessage( operation, param, null )
                                    + ": " + cause.getMessage() );
            e.initCause( cause );
            return e;
        }
    }

    /**
     * Returns an exception reporting that something does not exist.
     *
     * @param  operation  operation label
     * @param  param   name of the missing item
     * @return  new exception of kind NOT_FOUND
     */
    public static ImagCdfException notFound( String operation, String param ) {
        return new ImagCdfException( Kind.NOT_FOUND,
                                     formatMessage( operation, param, null )
                                   + " not found" );
    }

    /**
     * Composes a short message from its parts.
     * Absent parts are omitted, so the result is one of
     * "op", "op param", "op: status" or "op param: status".
     *
     * @param  operation  operation label
     * @param  param   attribute or variable name, or null
     * @param  status  container status, or null
     * @return  message text
     */
    public static String formatMessage( String operation, String param,
                                        CdfStatus status ) {
        StringBuffer sbuf = new StringBuffer( operation );
        if ( param != null && param.length() > 0 ) {
            sbuf.append( ' ' )
                .append( param );
        }
        if ( status != null ) {
            sbuf.append( ": " )
                .append( status.toMessage() );
        }
        return sbuf.toString();
    }

    /**
     * Failure categories.
     */
    public enum Kind {

        /** The container engine reported a failure. */
        COLLABORATOR,

        /** An attribute, entry, variable or series is absent. */
        NOT_FOUND,

        /** Stored with the wrong primitive type or dimensionality. */
        TYPE_MISMATCH,

        /** Metadata present and well typed but breaking format rules. */
        VALIDATION,

        /** A caller-supplied value cannot be mapped. */
        INVALID_ARGUMENT,

        /** A result too large to materialise. */
        ALLOCATION;
    }
}
