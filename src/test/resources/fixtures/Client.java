package flag;

public class Client {

    private static final String STALE_FLAG_CONST = "staleFlag";
    private static final String NORMAL_FLAG = "normalFlag";

    private final Experiments exp;

    public Client(Experiments exp) {
        this.exp = exp;
    }

    void a() {
        if (exp.boolValue(STALE_FLAG_CONST)) {
            System.out.println("true");
        } else {
            System.out.println("false");
        }
    }

    void b() {
        boolean enabled = exp.boolValue(STALE_FLAG_CONST);

        String s = exp.strValue("str");
        if (s == null) {
            System.out.println("missing");
        }

        if (enabled) {
            System.out.println("enabled");
        } else {
            System.out.println(STALE_FLAG_CONST);
        }
    }

    void c(boolean enabled2, boolean enabled3) {
        boolean enabled = exp.boolValue(STALE_FLAG_CONST);

        if (enabled || enabled2 || enabled3) {
            System.out.println("enabled");
        }
    }

    // should not replace the method name
    boolean isEnabled() {
        boolean isEnabled = exp.boolValue(STALE_FLAG_CONST);
        return isEnabled;
    }

    void callerMethod() {
        // should not replace isFlagEnabledMethod here
        if (this.isFlagEnabledMethod()) {
            System.out.println("enabled");
        } else {
            System.out.println("disabled");
        }
    }

    // should not replace the method name
    boolean isFlagEnabledMethod() {
        boolean isFlagEnabledMethod = exp.boolValue(STALE_FLAG_CONST);

        if (!isFlagEnabledMethod) {
            System.out.println("not enabled");
            return false;
        }

        return isFlagEnabledMethod;
    }

    static void callerFunc(Experiments exp) {
        // should not replace isFlagEnabledFunc here
        if (isFlagEnabledFunc(exp)) {
            System.out.println("enabled");
        } else {
            System.out.println("disabled");
        }
    }

    // should not replace the method name
    static boolean isFlagEnabledFunc(Experiments exp) {
        boolean isFlagEnabledFunc = exp.boolValue(STALE_FLAG_CONST);

        if (!isFlagEnabledFunc) {
            System.out.println("not enabled");
            return false;
        }

        return isFlagEnabledFunc;
    }
}
