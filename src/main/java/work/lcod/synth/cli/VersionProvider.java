package work.lcod.synth.cli;

import picocli.CommandLine;

/**
 * Reports the title and version the jar manifest carries, or a development marker when run
 * from classes.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEFAULT_TITLE = "lcod-synth";
    static final String DEVELOPMENT = "development";

    @Override
    public String[] getVersion() {
        var pkg = SynthCommand.class.getPackage();
        return new String[] { describe(pkg.getImplementationTitle(), pkg.getImplementationVersion()) };
    }

    static String describe(String title, String version) {
        var name = title == null || title.isBlank() ? DEFAULT_TITLE : title;
        return name + " " + (version == null || version.isBlank() ? DEVELOPMENT : version) + " (java "
            + Runtime.version().feature() + ")";
    }
}
