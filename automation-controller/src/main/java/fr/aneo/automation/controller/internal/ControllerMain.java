/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package fr.aneo.automation.controller.internal;

import fr.aneo.automation.controller.AutomationController;
import fr.aneo.automation.controller.ControllerConfig;
import fr.aneo.automation.domain.engine.Engine;
import fr.aneo.automation.domain.seed.SessionSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;

/**
 * Process entry point of the controller.
 * <p>
 * This class is internal infrastructure code and not part of the public API. It is referenced
 * only by the JAR manifest. The engine implementation is discovered with {@link ServiceLoader};
 * the main thread becomes the engine-affine thread.
 * </p>
 */
final class ControllerMain {
  private static final Logger logger = LoggerFactory.getLogger(ControllerMain.class);

  private ControllerMain() {
  }

  public static void main(String[] args) {
    logger.info("Starting automation controller");

    try {
      var engine = loadEngine();
      var sessionSeed = SessionSeed.resolve(args, System.getenv());
      var config = ControllerConfig.fromEnvironment();

      var controller = AutomationController.create(config, engine, sessionSeed, System.in, System.out);
      Runtime.getRuntime().addShutdownHook(new Thread(controller::close, "automation-shutdown"));

      controller.start();
      controller.runScheduler();
      controller.close();

      logger.info("Automation controller exited normally");
    } catch (Exception e) {
      logger.error("Automation controller failed", e);
      System.exit(1);
    }
  }

  static Engine loadEngine() {
    return ServiceLoader.load(Engine.class)
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("No " + Engine.class.getName() + " implementation found on the class path"));
  }
}
