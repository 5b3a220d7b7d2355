package io.intellixity.mapflow.examples.web;

import io.intellixity.mapflow.engine.exec.QueryDriver;
import io.intellixity.mapflow.engine.exec.StartResult;
import io.intellixity.mapflow.examples.config.MapflowProperties;
import io.intellixity.mapflow.exec.ResultSink;
import io.intellixity.mapflow.exec.ResultTransformer;
import io.intellixity.mapflow.query.MapReduceJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/mapred")
public final class MapReduceController {
  private static final Logger log = LoggerFactory.getLogger(MapReduceController.class);

  private final QueryDriver driver;
  private final MapflowProperties props;

  public MapReduceController(QueryDriver driver, MapflowProperties props) {
    this.driver = driver;
    this.props = props;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<Map<String, Object>> submit(@RequestBody MapReduceJob job) {
    String requestId = UUID.randomUUID().toString();
    StartResult r = driver.start(props.getNode(), LOG_SINK, requestId, job, ResultTransformer.identity(), props.getDefaultTimeoutMs());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("requestId", requestId);
    if (r instanceof StartResult.BadQueryTerm bad) {
      body.put("error", "bad_qterm");
      body.put("term", bad.term());
      return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
    StartResult.Started started = (StartResult.Started) r;
    body.put("flowId", started.flow().flowId());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
  }

  /** Malformed job JSON (unknown step type, non-boolean keep, missing query array). */
  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> malformedJob(IllegalArgumentException e) {
    return badJob(e.getMessage());
  }

  /** Body that is not JSON at all, or a job codec error wrapped by Jackson. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> unreadableJob(HttpMessageNotReadableException e) {
    Throwable cause = e;
    while (cause.getCause() != null && !(cause instanceof IllegalArgumentException)) cause = cause.getCause();
    return badJob(cause.getMessage());
  }

  private static ResponseEntity<Map<String, Object>> badJob(String message) {
    log.debug("Rejected malformed map-reduce job: {}", message);
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", "bad_job");
    body.put("message", message);
    return ResponseEntity.badRequest().body(body);
  }

  private static final ResultSink LOG_SINK = new ResultSink() {
    @Override
    public void deliver(String requestId, List<Object> results) {
      log.info("Request {} finished with {} results", requestId, results.size());
    }

    @Override
    public void fail(String requestId, Throwable error) {
      log.warn("Request {} failed", requestId, error);
    }
  };
}
