package datahandler.netty;

public class Constants {

    public static final String ERR_WRITING_RESPONSE = "Error writing response to pipeline: {}";
    public static final String JSON_TYPE = "application/json";
    public static final String LOG_RETURNING_RESPONSE = "Returning response {}";
}
