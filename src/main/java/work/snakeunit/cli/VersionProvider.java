package work.snakeunit.cli;

import picocli.CommandLine;

/** Version banner: the tool, the JVM running it and the picocli release. */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String UNPACKAGED = "development";

    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "snakeunit " + (implementationVersion != null ? implementationVersion : UNPACKAGED),
            "JVM " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")",
            "picocli " + CommandLine.VERSION
        };
    }
}
