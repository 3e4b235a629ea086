package org.alertingupgrade.migrations.arguments;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public class ArgNameConstants {

    private ArgNameConstants() {
        throw new IllegalStateException("Constant class should not be instantiated");
    }

    public static final Pattern POSSIBLE_CREDENTIALS_ARG_FLAG_NAMES =
        Pattern.compile("--(?:db(?:(?:-u|U)sername|(?:-p|P)assword)|secret(?:-k|K)ey)");

    public static final String DB_PASSWORD_ARG_KEBAB_CASE = "--db-password";
    public static final String DB_PASSWORD_ARG_CAMEL_CASE = "--dbPassword";
    public static final String DB_USERNAME_ARG_KEBAB_CASE = "--db-username";
    public static final String DB_USERNAME_ARG_CAMEL_CASE = "--dbUsername";
    public static final String SECRET_KEY_ARG_KEBAB_CASE = "--secret-key";
    public static final String SECRET_KEY_ARG_CAMEL_CASE = "--secretKey";
    public static final List<String> CENSORED_DB_ARGS = List.of(DB_PASSWORD_ARG_KEBAB_CASE, DB_PASSWORD_ARG_CAMEL_CASE);
    public static final List<String> CENSORED_SECRET_ARGS = List.of(SECRET_KEY_ARG_KEBAB_CASE, SECRET_KEY_ARG_CAMEL_CASE);

    @SafeVarargs
    public static List<String> joinLists(List<String>... lists) {
        List<String> result = new ArrayList<>();
        for (List<String> list : lists) {
            result.addAll(list);
        }
        return result;
    }
}
