package run.telo.kernel.runtime;

/**
 * Builds provenance URIs recorded in {@code metadata.uri}.
 */
public final class ResourceUri {
    private ResourceUri() {}

    public static String forLocation(String location, String kind, String name) {
        return location + "#" + kind + "." + name;
    }

    public static String forTemplate(String templateName) {
        return "template://" + templateName;
    }

    public static String child(String parentUri, String kind, String name) {
        return parentUri + "/" + kind + "." + name;
    }
}
