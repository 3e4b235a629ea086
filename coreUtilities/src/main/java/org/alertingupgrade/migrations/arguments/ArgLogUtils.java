package org.alertingupgrade.migrations.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Renders command lines for logs without leaking credentials */
public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static final String CENSORED_VALUE = "******";

    /**
     * Replaces the value following any censored flag. Handles both "--flag value" and "--flag=value".
     */
    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredArgs) {
        List<String> redactedArgs = new ArrayList<>();
        boolean shouldCensorNext = false;

        for (String arg : args) {
            var equalsIndex = arg.indexOf('=');
            if (shouldCensorNext) {
                redactedArgs.add(CENSORED_VALUE);
                shouldCensorNext = false;
            } else if (censoredArgs.contains(arg)) {
                redactedArgs.add(arg);
                shouldCensorNext = true;
            } else if (equalsIndex > 0 && censoredArgs.contains(arg.substring(0, equalsIndex))) {
                redactedArgs.add(arg.substring(0, equalsIndex + 1) + CENSORED_VALUE);
            } else {
                redactedArgs.add(arg);
            }
        }

        return redactedArgs;
    }
}
