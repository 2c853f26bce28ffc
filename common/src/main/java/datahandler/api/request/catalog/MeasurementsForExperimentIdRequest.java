package datahandler.api.request.catalog;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

import datahandler.api.annotation.Http;
import datahandler.api.request.DatasourceRequest;
import datahandler.api.request.HttpGetRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

@Http(path = "/get_measurements_for_experimentId")
public class MeasurementsForExperimentIdRequest extends DatasourceRequest {

    private String experimentId;

    public String getExperimentId() {
        return experimentId;
    }

    public void setExperimentId(String experimentId) {
        this.experimentId = experimentId;
    }

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        MeasurementsForExperimentIdRequest request = new MeasurementsForExperimentIdRequest();
        List<String> segments = getPathParameters(decoder);
        if (segments.size() > 0) {
            request.setDatasource(segments.get(0));
        }
        if (segments.size() > 1) {
            request.setExperimentId(segments.get(1));
        }
        return request;
    }

    @Override
    public void validate() {
        super.validate();
        if (StringUtils.isBlank(experimentId)) {
            throw new IllegalArgumentException("experimentId is required");
        }
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("datasource", getDatasource());
        tsb.append("experimentId", experimentId);
        return tsb.toString();
    }
}
