package app.jira;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JiraMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(JiraMcpApplication.class, args);
    }
}
