package io.intellixity.mapflow.examples;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(excludeName = {
    "org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration",
    "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration"
})
public class MapflowExamplesApplication {
  public static void main(String[] args) {
    SpringApplication.run(MapflowExamplesApplication.class, args);
  }
}
