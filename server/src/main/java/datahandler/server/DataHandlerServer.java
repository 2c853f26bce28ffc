package datahandler.server;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"datahandler.server", "datahandler.common"})
public class DataHandlerServer {

    public static void main(String[] args) {
        new SpringApplicationBuilder(DataHandlerServer.class).main(DataHandlerServer.class).web(WebApplicationType.NONE).run(args);
    }
}
