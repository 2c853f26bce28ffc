package datahandler.api.response;

import java.io.Serializable;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an error response. The message is published as "error", the key clients of the handler read.
 */
public class DataHandlerExceptionResponse implements Serializable {

    private static final long serialVersionUID = 2412286318232017571L;

    @JsonProperty("error")
    public String message;
    public String details;
    public int code;

    public DataHandlerExceptionResponse(DataHandlerException e) {
        this.message = e.getMessage();
        this.details = e.getDetails();
        this.code = e.getCode();
    }
}
