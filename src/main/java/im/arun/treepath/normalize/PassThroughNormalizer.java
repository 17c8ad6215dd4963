package im.arun.treepath.normalize;

/**
 * Leaves every value untouched.
 */
public class PassThroughNormalizer implements Normalizer {

    @Override
    public String desensitize(String value) {
        return value;
    }

    @Override
    public String formalize(String value) {
        return value;
    }
}
