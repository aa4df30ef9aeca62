package win.ixuni.splice.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import win.ixuni.splice.core.merge.MergeConstants;

import java.util.ArrayList;
import java.util.List;

/**
 * S3Splice main configuration
 */
@Data
@ConfigurationProperties(prefix = "splice")
public class SpliceProperties {

    /**
     * Store driver used for every merge
     */
    private DriverConfig driver = new DriverConfig();

    /**
     * Merge behaviour
     */
    private MergeConfig merge = new MergeConfig();

    @Data
    public static class MergeConfig {

        /**
         * Marker objects removed from the prefix after a merge when success file deletion is enabled
         */
        private List<String> markerFiles = new ArrayList<>(MergeConstants.DEFAULT_MARKER_FILES);

        /**
         * Page size requested from the store when listing the prefix
         */
        private int listPageSize = MergeConstants.DEFAULT_LIST_PAGE_SIZE;
    }
}
