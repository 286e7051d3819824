package org.pharmaguard.utils.config;

import htsjdk.samtools.util.Log;
import org.pharmaguard.cmdline.StandardArgumentDefinitions;
import org.pharmaguard.exceptions.UserException;
import org.pharmaguard.testutils.PgxBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class ConfigFactoryTest extends PgxBaseTest {

    private static final String CONFIG_OPTION = "--" + StandardArgumentDefinitions.CONFIG_FILE_OPTION;

    // Fresh instance each call, so overrides made by a test never reach the cached config.
    private static PharmaGuardConfig uncachedConfig() {
        final ConfigFactory factory = ConfigFactory.getInstance();
        factory.setUnsetPathVariablesToNoPath(factory.getSourcesAnnotationPathVariables(PharmaGuardConfig.class));
        return org.aeonbits.owner.ConfigFactory.create(PharmaGuardConfig.class);
    }

    @Test
    public void testDefaultValues() {
        final PharmaGuardConfig config = uncachedConfig();
        assertEqualsDoubleSmart(config.pgx_min_variant_quality(), 20.0);
        Assert.assertEquals(config.pgx_rules_catalog_path(), PharmaGuardConfig.NO_PATH);
        Assert.assertEquals(config.pgx_pharmgkb_annotations_path(), PharmaGuardConfig.NO_PATH);
        Assert.assertEquals(config.pgx_analysis_version(), "1.0.0");
        Assert.assertFalse(config.pgx_stacktrace_on_user_exception());
    }

    @Test
    public void testConfigFileOverridesDefaults() {
        final String previous = org.aeonbits.owner.ConfigFactory.getProperty(PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME);
        org.aeonbits.owner.ConfigFactory.setProperty(PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME,
                getTestFile("test_config.properties").getAbsolutePath());
        try {
            final PharmaGuardConfig config = uncachedConfig();
            assertEqualsDoubleSmart(config.pgx_min_variant_quality(), 35.5);
            Assert.assertEquals(config.pgx_analysis_version(), "9.9.9-test");
            // keys missing from the file fall through to the bundled defaults
            Assert.assertFalse(config.pgx_stacktrace_on_user_exception());
        } finally {
            org.aeonbits.owner.ConfigFactory.setProperty(PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME,
                    previous == null ? ConfigFactory.NO_PATH_VARIABLE_VALUE : previous);
        }
    }

    @Test
    public void testMutableConfig() {
        final PharmaGuardConfig config = uncachedConfig();
        config.setProperty("pgx.min_variant_quality", "42");
        assertEqualsDoubleSmart(config.pgx_min_variant_quality(), 42.0);
        Assert.assertEquals(config.getProperty("pgx.min_variant_quality"), "42");
        ConfigFactory.logConfigFields(config, Log.LogLevel.DEBUG);
    }

    @Test
    public void testCachedConfigIsShared() {
        Assert.assertSame(ConfigFactory.getInstance().getPharmaGuardConfig(), ConfigFactory.getInstance().getPharmaGuardConfig());
    }

    @Test
    public void testSourcesAnnotationPathVariables() {
        Assert.assertEquals(ConfigFactory.getInstance().getSourcesAnnotationPathVariables(PharmaGuardConfig.class),
                Arrays.asList(PharmaGuardConfig.CONFIG_FILE_VARIABLE_FILE_NAME, PharmaGuardConfig.CONFIG_FILE_VARIABLE_CLASS_PATH));
    }

    @Test
    public void testUnsetPathVariablesPointNowhere() {
        final String variable = "PharmaGuardConfigTest.unsetVariable";
        ConfigFactory.getInstance().setUnsetPathVariablesToNoPath(Collections.singletonList(variable));
        Assert.assertEquals(org.aeonbits.owner.ConfigFactory.getProperty(variable), ConfigFactory.NO_PATH_VARIABLE_VALUE);
    }

    @DataProvider(name = "configArgs")
    public Object[][] configArgs() {
        return new Object[][]{
                {new String[]{"AnalyzePharmacogenomics", CONFIG_OPTION, "my.properties", "-V", "x.vcf"}, "my.properties"},
                {new String[]{"AnalyzePharmacogenomics", "-V", "x.vcf"}, null},
                {new String[]{}, null},
        };
    }

    @Test(dataProvider = "configArgs")
    public void testGetConfigFilenameFromArgs(final String[] args, final String expected) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION), expected);
    }

    @DataProvider(name = "missingConfigValue")
    public Object[][] missingConfigValue() {
        final List<String[]> cases = Arrays.asList(
                new String[]{"AnalyzePharmacogenomics", CONFIG_OPTION},
                new String[]{"AnalyzePharmacogenomics", CONFIG_OPTION, "--verbosity", "INFO"});
        return cases.stream().map(a -> new Object[]{a}).toArray(Object[][]::new);
    }

    @Test(dataProvider = "missingConfigValue", expectedExceptions = UserException.BadInput.class)
    public void testConfigOptionWithoutValue(final String[] args) {
        ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION);
    }
}
