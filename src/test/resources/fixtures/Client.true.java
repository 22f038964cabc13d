package flag;

public class Client {

    private static final String NORMAL_FLAG = "normalFlag";

    private final Experiments exp;

    public Client(Experiments exp) {
        this.exp = exp;
    }

    void a() {
        System.out.println("true");
    }

    void b() {
        String s = exp.strValue("str");
        if (s == null) {
            System.out.println("missing");
        }
        System.out.println("enabled");
    }

    void c(boolean enabled2, boolean enabled3) {
        System.out.println("enabled");
    }

    boolean isEnabled() {
        return true;
    }

    void callerMethod() {
        if (this.isFlagEnabledMethod()) {
            System.out.println("enabled");
        } else {
            System.out.println("disabled");
        }
    }

    boolean isFlagEnabledMethod() {
        return true;
    }

    static void callerFunc(Experiments exp) {
        if (isFlagEnabledFunc(exp)) {
            System.out.println("enabled");
        } else {
            System.out.println("disabled");
        }
    }

    static boolean isFlagEnabledFunc(Experiments exp) {
        return true;
    }
}
