package io.zeroledger.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.zeroledger.model.Job;
import io.zeroledger.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class ScriptWorkerTest {

    @Test
    void parsesOneCandidatePerLine() {
        List<JsonNode> out = ScriptWorker.parseOutput("{\"t\":1.0,\"root_val\":1e-14}\r\n\n  not json  \n{\"t\":2.0,\"root_val\":0}\n");

        Assertions.assertEquals(3, out.size());
        Assertions.assertEquals(1.0d, out.get(0).path("t").asDouble());
        Assertions.assertTrue(out.get(1).isTextual());
        Assertions.assertEquals("not json", out.get(1).asText());
        Assertions.assertEquals(2.0d, out.get(2).path("t").asDouble());
    }

    @Test
    void jobInputCarriesIdAndPayload() throws Exception {
        Job job = Job.pending("range-1", Jsons.mapper().readTree("{\"t_start\":1}"), 0L);

        JsonNode input = Jsons.mapper().readTree(ScriptWorker.jobInput(job));

        Assertions.assertEquals("range-1", input.path("job_id").asText());
        Assertions.assertEquals(1, input.path("payload").path("t_start").asInt());
    }

    @Test
    void runsCommandAndReadsStdout() throws Exception {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ScriptWorker worker = new ScriptWorker(List.of("/bin/sh", "-c", "cat >/dev/null; echo '{\"t\":3.5,\"root_val\":0.0}'"), 5_000L);

        List<JsonNode> out = worker.compute(Job.pending("j", null, 0L));

        Assertions.assertEquals(1, out.size());
        Assertions.assertEquals(3.5d, out.get(0).path("t").asDouble());
    }

    @Test
    void nonZeroExitFailsTheJob() {
        Assumptions.assumeTrue(Files.isExecutable(Path.of("/bin/sh")));
        ScriptWorker worker = new ScriptWorker(List.of("/bin/sh", "-c", "cat >/dev/null; echo oops; exit 3"), 5_000L);

        IllegalStateException e = Assertions.assertThrows(IllegalStateException.class,
                () -> worker.compute(Job.pending("j", null, 0L)));
        Assertions.assertTrue(e.getMessage().contains("exit=3"));
        Assertions.assertTrue(e.getMessage().contains("oops"));
    }

    @Test
    void rejectsEmptyCommand() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ScriptWorker(List.of(), 1_000L));
    }
}
