package datahandler.api.request.catalog;

import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

import datahandler.api.annotation.Http;
import datahandler.api.request.DatasourceRequest;
import datahandler.api.request.HttpGetRequest;
import io.netty.handler.codec.http.QueryStringDecoder;

@Http(path = "/get_experimentIds_for_measurement")
public class ExperimentIdsForMeasurementRequest extends DatasourceRequest {

    private String measurement;

    public String getMeasurement() {
        return measurement;
    }

    public void setMeasurement(String measurement) {
        this.measurement = measurement;
    }

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        ExperimentIdsForMeasurementRequest request = new ExperimentIdsForMeasurementRequest();
        List<String> segments = getPathParameters(decoder);
        if (segments.size() > 0) {
            request.setDatasource(segments.get(0));
        }
        if (segments.size() > 1) {
            request.setMeasurement(segments.get(1));
        }
        return request;
    }

    @Override
    public void validate() {
        super.validate();
        if (StringUtils.isBlank(measurement)) {
            throw new IllegalArgumentException("measurement is required");
        }
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("datasource", getDatasource());
        tsb.append("measurement", measurement);
        return tsb.toString();
    }
}
