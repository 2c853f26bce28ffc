package datahandler.api.request.timeseries;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;

import datahandler.api.annotation.Http;
import datahandler.api.request.DatasourceRequest;
import datahandler.api.request.HttpGetRequest;
import datahandler.model.OutlierMode;
import datahandler.util.DurationParser;
import io.netty.handler.codec.http.QueryStringDecoder;

/**
 * Retrieval of one experiment, or the comparison of two experiments when a second identifier is given.
 */
@Http(path = "/get_data")
public class DataRequest extends DatasourceRequest {

    public static final int DEFAULT_CHUNK_SIZE = 10000;

    private String experimentId;
    private Optional<String> comparedExperimentId = Optional.empty();
    private List<String> measurements = new ArrayList<>();
    private List<String> fields = new ArrayList<>();
    private Optional<String> additionalClause = Optional.empty();
    private boolean chunked = false;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private boolean matchSeries = false;
    private OutlierMode outlierMode = OutlierMode.NONE;
    private Optional<Integer> limit = Optional.empty();
    private Optional<Integer> offset = Optional.empty();
    private Optional<String> maxLag = Optional.empty();

    @Override
    public HttpGetRequest parseQueryParameters(QueryStringDecoder decoder) throws Exception {
        final DataRequest request = new DataRequest();
        List<String> segments = getPathParameters(decoder);
        if (segments.size() > 3) {
            throw new IllegalArgumentException("at most two experiment identifiers can be compared");
        }
        if (segments.size() > 0) {
            request.setDatasource(segments.get(0));
        }
        if (segments.size() > 1) {
            request.setExperimentId(segments.get(1));
        }
        if (segments.size() > 2) {
            request.setComparedExperimentId(Optional.of(segments.get(2)));
        }
        request.setMeasurements(getParameters(decoder, "measurement"));
        request.setFields(getParameters(decoder, "field"));
        request.setAdditionalClause(Optional.ofNullable(getParameter(decoder, "additional_clause")));
        request.setChunked(getBooleanParameter(decoder, "chunked"));
        Integer chunkSize = getIntegerParameter(decoder, "chunk_size");
        if (chunkSize != null) {
            request.setChunkSize(chunkSize);
        }
        request.setMatchSeries(getBooleanParameter(decoder, "match_series"));
        request.setOutlierMode(OutlierMode.parse(getParameter(decoder, "remove_outliers")));
        request.setLimit(Optional.ofNullable(getIntegerParameter(decoder, "limit")));
        request.setOffset(Optional.ofNullable(getIntegerParameter(decoder, "offset")));
        String maxLag = getParameter(decoder, "max_lag");
        if (StringUtils.isNotBlank(maxLag)) {
            request.setMaxLag(Optional.of(maxLag.trim()));
        }
        return request;
    }

    @Override
    public void validate() {
        super.validate();
        if (StringUtils.isBlank(experimentId)) {
            throw new IllegalArgumentException("experimentId is required");
        }
        if (limit.isPresent() && limit.get() < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (offset.isPresent() && offset.get() < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk_size must be positive");
        }
        maxLag.ifPresent(DurationParser::toMillis);
    }

    public boolean isComparison() {
        return comparedExperimentId.isPresent();
    }

    public String getExperimentId() {
        return experimentId;
    }

    public void setExperimentId(String experimentId) {
        this.experimentId = experimentId;
    }

    public Optional<String> getComparedExperimentId() {
        return comparedExperimentId;
    }

    public void setComparedExperimentId(Optional<String> comparedExperimentId) {
        this.comparedExperimentId = comparedExperimentId;
    }

    public List<String> getMeasurements() {
        return measurements;
    }

    public void setMeasurements(List<String> measurements) {
        this.measurements = measurements;
    }

    public List<String> getFields() {
        return fields;
    }

    public void setFields(List<String> fields) {
        this.fields = fields;
    }

    public Optional<String> getAdditionalClause() {
        return additionalClause;
    }

    public void setAdditionalClause(Optional<String> additionalClause) {
        this.additionalClause = additionalClause;
    }

    public boolean isChunked() {
        return chunked;
    }

    public void setChunked(boolean chunked) {
        this.chunked = chunked;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public boolean isMatchSeries() {
        return matchSeries;
    }

    public void setMatchSeries(boolean matchSeries) {
        this.matchSeries = matchSeries;
    }

    public OutlierMode getOutlierMode() {
        return outlierMode;
    }

    public void setOutlierMode(OutlierMode outlierMode) {
        this.outlierMode = outlierMode;
    }

    public Optional<Integer> getLimit() {
        return limit;
    }

    public void setLimit(Optional<Integer> limit) {
        this.limit = limit;
    }

    public Optional<Integer> getOffset() {
        return offset;
    }

    public void setOffset(Optional<Integer> offset) {
        this.offset = offset;
    }

    public Optional<String> getMaxLag() {
        return maxLag;
    }

    public void setMaxLag(Optional<String> maxLag) {
        this.maxLag = maxLag;
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("datasource", getDatasource());
        tsb.append("experimentId", experimentId);
        tsb.append("comparedExperimentId", comparedExperimentId);
        tsb.append("measurements", measurements);
        tsb.append("fields", fields);
        tsb.append("additionalClause", additionalClause);
        tsb.append("chunked", chunked);
        tsb.append("chunkSize", chunkSize);
        tsb.append("matchSeries", matchSeries);
        tsb.append("outlierMode", outlierMode);
        tsb.append("limit", limit);
        tsb.append("offset", offset);
        tsb.append("maxLag", maxLag);
        return tsb.toString();
    }
}
