package forcelink;

/**
 * A class in the root package used to point Weld at the packages to scan.
 */
public final class Marker {
    private Marker() {
    }
}
