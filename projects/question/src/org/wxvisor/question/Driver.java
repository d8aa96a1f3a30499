package org.wxvisor.question;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.codehaus.jettison.json.JSONException;
import org.codehaus.jettison.json.JSONObject;
import org.wxvisor.common.ConfigurationException;
import org.wxvisor.common.OracleUnavailableException;
import org.wxvisor.common.WxvisorException;
import org.wxvisor.common.plugin.IWxvisor;
import org.wxvisor.datamodel.answers.AnswerElement;
import org.wxvisor.datamodel.questions.Question;
import org.wxvisor.main.Wxvisor;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * <p>Command line entry point. Each argument is either the name of a
 * question, answered with default parameters, or the path of a question
 * file:</p>
 *
 * <pre>
 * {"question": "smt-wxvisor", "parameters": {"va": "0x12345000"}}
 * </pre>
 *
 * <p>Without arguments the bundled scenario questions are answered.</p>
 */
public class Driver {

    private static final Logger LOGGER = LogManager.getLogger(Driver.class);

    private static final String QUESTION_VAR = "question";

    private static final String PARAMETERS_VAR = "parameters";

    static final List<String> BUNDLED_QUESTIONS = Arrays.asList(
            "questions/basic-paging.json",
            "questions/aliasing.json",
            "questions/single-level-wx.json",
            "questions/wxvisor.json");

    private final Map<String, QuestionPlugin> _plugins;

    private final IWxvisor _wxvisor;

    public Driver(IWxvisor wxvisor) {
        _wxvisor = wxvisor;
        _plugins = new TreeMap<>();
        for (QuestionPlugin plugin : ServiceLoader.load(QuestionPlugin.class)) {
            _plugins.put(plugin.getQuestionName(), plugin);
        }
    }

    public static void main(String[] args) {
        System.exit(new Driver(new Wxvisor()).run(args, System.out));
    }

    /**
     * Answer every question in order.
     * @return 0 once every question is solved, 1 on a configuration or
     * solver error
     */
    public int run(String[] args, PrintStream out) {
        try {
            if (args.length == 0) {
                for (String resource : BUNDLED_QUESTIONS) {
                    answer(readResource(resource), out);
                }
            } else {
                for (String arg : args) {
                    if (_plugins.containsKey(arg)) {
                        answer(arg, new JSONObject(), out);
                    } else {
                        answer(readFile(Paths.get(arg)), out);
                    }
                }
            }
            return 0;
        } catch (ConfigurationException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage(), e);
            return 1;
        } catch (OracleUnavailableException e) {
            LOGGER.error("Solver unavailable: {}", e.getMessage(), e);
            return 1;
        }
    }

    private void answer(String json, PrintStream out) {
        try {
            JSONObject file = new JSONObject(json);
            String name = file.getString(QUESTION_VAR);
            JSONObject parameters = file.has(PARAMETERS_VAR) ?
                    file.getJSONObject(PARAMETERS_VAR) : new JSONObject();
            answer(name, parameters, out);
        } catch (JSONException e) {
            throw new ConfigurationException("Malformed question file", e);
        }
    }

    private void answer(String name, JSONObject parameters, PrintStream out) {
        QuestionPlugin plugin = _plugins.get(name);
        if (plugin == null) {
            throw new ConfigurationException("Unknown question " + name + ", expected one of " +
                    _plugins.keySet());
        }
        Question question = plugin.parseQuestion(parameters);
        LOGGER.info("Answering {}", question.prettyPrint());
        AnswerElement answer = plugin.answer(question, _wxvisor);
        try {
            out.print(answer.prettyPrint());
        } catch (JsonProcessingException e) {
            throw new WxvisorException("Could not print answer to " + name, e);
        }
        out.flush();
    }

    private static String readFile(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read question file " + path, e);
        }
    }

    private static String readResource(String resource) {
        try (InputStream in = Driver.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Missing bundled question " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read bundled question " + resource, e);
        }
    }

    public List<String> getQuestionNames() {
        return new ArrayList<>(_plugins.keySet());
    }
}
