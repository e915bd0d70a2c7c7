package io.controlplane.join;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cluster CA material handed to a joining controller. Binary fields travel base64 encoded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CaResponse {
    private byte[] key;
    private byte[] cert;
    private byte[] saKey;
    private byte[] saPub;
}
