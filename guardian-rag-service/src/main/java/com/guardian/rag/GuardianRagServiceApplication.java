package com.guardian.rag;

import com.guardian.rag.cli.GuardianCli;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GuardianRagServiceApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(GuardianRagServiceApplication.class);

        // A leading subcommand runs the CLI without the web server
        if (args.length > 0 && GuardianCli.isCommand(args[0])) {
            app.setWebApplicationType(WebApplicationType.NONE);
            app.setAdditionalProfiles("cli");
            System.exit(SpringApplication.exit(app.run(args)));
        }

        app.run(args);
    }
}
