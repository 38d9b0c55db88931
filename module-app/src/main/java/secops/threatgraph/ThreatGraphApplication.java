package secops.threatgraph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ThreatGraphApplication {

  public static void main(String[] args) {
    SpringApplication.run(ThreatGraphApplication.class, args);
  }
}
