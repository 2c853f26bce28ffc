package datahandler.server.store;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Endpoint and credentials of one datasource, that is one bucket of an InfluxDB organization.
 */
public class ConnectionDetails {

    private final String name;
    private final String url;
    private final String org;
    private final String bucket;
    private final String token;

    public ConnectionDetails(String name, String url, String org, String bucket, String token) {
        this.name = name;
        this.url = url;
        this.org = org;
        this.bucket = bucket;
        this.token = token;
    }

    public String getName() {
        return name;
    }

    public String getUrl() {
        return url;
    }

    public String getOrg() {
        return org;
    }

    public String getBucket() {
        return bucket;
    }

    public String getToken() {
        return token;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ConnectionDetails)) {
            return false;
        }
        ConnectionDetails other = (ConnectionDetails) obj;
        EqualsBuilder eq = new EqualsBuilder();
        eq.append(name, other.name);
        eq.append(url, other.url);
        eq.append(org, other.org);
        eq.append(bucket, other.bucket);
        eq.append(token, other.token);
        return eq.isEquals();
    }

    @Override
    public int hashCode() {
        HashCodeBuilder hcb = new HashCodeBuilder();
        hcb.append(name);
        hcb.append(url);
        hcb.append(org);
        hcb.append(bucket);
        hcb.append(token);
        return hcb.toHashCode();
    }

    @Override
    public String toString() {
        // token left out on purpose, this ends up in logs
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("name", name);
        tsb.append("url", url);
        tsb.append("org", org);
        tsb.append("bucket", bucket);
        return tsb.toString();
    }
}
