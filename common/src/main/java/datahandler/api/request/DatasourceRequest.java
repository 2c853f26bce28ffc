package datahandler.api.request;

import org.apache.commons.lang3.StringUtils;

/**
 * A request addressed to one configured datasource, named by the first path segment after the route.
 */
public abstract class DatasourceRequest extends AbstractHttpGetRequest {

    private String datasource;

    public String getDatasource() {
        return datasource;
    }

    public void setDatasource(String datasource) {
        this.datasource = datasource;
    }

    @Override
    public void validate() {
        if (StringUtils.isBlank(datasource)) {
            throw new IllegalArgumentException("datasource is required");
        }
    }
}
