package de.synchrolib.app;

import java.util.Arrays;

import de.synchrolib.algorithm.synchro.AlgorithmPipeline;
import de.synchrolib.algorithm.synchro.ExactPowerSetSearch;
import de.synchrolib.algorithm.synchro.GreedyUpperBound;
import de.synchrolib.algorithm.synchro.PairGraphCheck;
import de.synchrolib.generator.canonical.DiscoveryConvention;
import org.testng.Assert;
import org.testng.annotations.Test;

public class RunConfigTest {

    @Test
    public void defaults() {
        RunConfig config = new RunConfig();

        Assert.assertNull(config.getStates());
        Assert.assertNull(config.getAlphabetSize());
        Assert.assertEquals(config.getConvention(), DiscoveryConvention.STRICT);
        Assert.assertNull(config.getInput());
        Assert.assertNull(config.getOutput());
        Assert.assertFalse(config.isWord());
        Assert.assertEquals(config.getExactMaxStates(), AlgorithmPipeline.DEFAULT_EXACT_MAX_STATES);
    }

    @Test
    public void defaultPipelineRunsAllAlgorithms() {
        AlgorithmPipeline pipeline = new RunConfig().createPipeline();

        Assert.assertEquals(pipeline.getAlgorithms().size(), 3);
        Assert.assertEquals(pipeline.getAlgorithms().get(0).getName(), PairGraphCheck.NAME);
        Assert.assertEquals(pipeline.getAlgorithms().get(1).getName(), GreedyUpperBound.NAME);
        Assert.assertEquals(pipeline.getAlgorithms().get(2).getName(), ExactPowerSetSearch.NAME);
        Assert.assertFalse(pipeline.isKeepWord());
    }

    @Test
    public void selectedAlgorithms() {
        RunConfig config = new RunConfig();
        config.setAlgorithms(Arrays.asList(ExactPowerSetSearch.NAME));
        config.setWord(true);

        AlgorithmPipeline pipeline = config.createPipeline();

        Assert.assertEquals(pipeline.getAlgorithms().size(), 2);
        Assert.assertEquals(pipeline.getAlgorithms().get(1).getName(), ExactPowerSetSearch.NAME);
        Assert.assertTrue(pipeline.isKeepWord());
    }

    @Test
    public void exactLimitIsChecked() {
        RunConfig config = new RunConfig();
        config.setExactMaxStates(ExactPowerSetSearch.HARD_LIMIT + 1);
        Assert.assertThrows(IllegalArgumentException.class, config::createPipeline);
    }
}
