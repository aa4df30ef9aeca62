package win.ixuni.splice.cli.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import win.ixuni.splice.core.exception.InvalidArgumentException;
import win.ixuni.splice.core.exception.SpliceException;
import win.ixuni.splice.core.merge.MergeRequest;
import win.ixuni.splice.core.merge.MergeResult;
import win.ixuni.splice.core.merge.ObjectsMerger;
import win.ixuni.splice.core.util.JsonUtils;

import java.util.List;

/**
 * Runs the merge described by the command line options
 * <p>
 * Without {@code --bucket} only the usage is printed and the store is not contacted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MergeCommandRunner implements ApplicationRunner {

    static final String BUCKET = "bucket";
    static final String NEW_OBJECT_KEY = "new-object-key";
    static final String INITIAL_NAME = "initial-name";
    static final String PREFIX = "prefix";
    static final String DELETE_SUCCESS_FILES = "delete-success-files";

    static final String USAGE = """
            Usage: s3splice --bucket=<bucket> --new-object-key=<key> --initial-name=<name>
                            [--prefix=<prefix>] [--delete-success-files=<true|false>]

              --bucket                 bucket holding the objects to merge
              --new-object-key         key of the merged object, its extension selects the merged inputs
              --initial-name           merge the objects whose name starts with this
              --prefix                 prefix the objects live under (default: bucket root)
              --delete-success-files   remove _SUCCESS and ._SUCCESS.crc under the prefix (default: true)
            """;

    private final ObjectsMerger merger;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(BUCKET)) {
            System.out.print(USAGE);
            return;
        }

        MergeRequest request = MergeRequest.builder()
                .bucketName(option(args, BUCKET, null))
                .newObjectKey(option(args, NEW_OBJECT_KEY, null))
                .objectsToMergeInitialName(option(args, INITIAL_NAME, null))
                .objectsToMergePrefix(option(args, PREFIX, ""))
                .deleteSuccessFiles(flag(args, DELETE_SUCCESS_FILES))
                .build();

        MergeResult result;
        try {
            result = merger.merge(request).block();
        } catch (SpliceException e) {
            log.error("Merge failed: {} - {}", e.getErrorCode(), e.getMessage());
            throw e;
        }

        System.out.println(JsonUtils.toJson(result));
    }

    private static String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    /**
     * A bare {@code --name} counts as true, an absent one as the default (true)
     */
    private static boolean flag(ApplicationArguments args, String name) {
        String value = option(args, name, "true");
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new InvalidArgumentException("--" + name + " must be true or false: " + value);
    }
}
