package at.sv.prayer;

import at.sv.prayer.method.CalculationMethod;
import at.sv.prayer.method.CalculationParameters;
import at.sv.prayer.method.HighLatitudeRule;
import at.sv.prayer.method.Madhab;
import at.sv.prayer.method.PrayerAdjustments;
import at.sv.prayer.method.Rounding;
import at.sv.prayer.method.Shafaq;
import at.sv.prayer.time.PrayerTimesProvider;
import at.sv.prayer.time.PrayerTimesProviderImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

@Command(name = "PrayerTimes", version = "0.1.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints the daily prayer times for a location.")
public final class PrayerTimesCli implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(PrayerTimesCli.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    double longitude;
    @Option(names = "--method",
            defaultValue = "${env:METHOD:-MUSLIM_WORLD_LEAGUE}",
            description = "The calculation method. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    CalculationMethod method;
    @Option(names = "--madhab",
            defaultValue = "${env:MADHAB:-SHAFI}",
            description = "The madhab used for asr. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Madhab madhab;
    @Option(names = "--high-latitude-rule",
            defaultValue = "${env:HIGH_LATITUDE_RULE}",
            description = "The rule bounding fajr and isha. Valid values: ${COMPLETION-CANDIDATES}. " +
                          "Default: the recommended rule for the latitude.")
    HighLatitudeRule highLatitudeRule;
    @Option(names = "--shafaq",
            defaultValue = "${env:SHAFAQ}",
            description = "The shafaq used by the Moonsighting Committee method for isha. " +
                          "Valid values: ${COMPLETION-CANDIDATES}. Default: the method's.")
    Shafaq shafaq;
    @Option(names = "--rounding",
            defaultValue = "${env:ROUNDING}",
            description = "How prayer times are rounded to minutes. Valid values: ${COMPLETION-CANDIDATES}. " +
                          "Default: the method's.")
    Rounding rounding;
    @Option(names = "--adjustment", paramLabel = "<prayer>=<minutes>",
            description = "Additional minutes for a prayer, e.g. 'ISHA=5'. Can be repeated.")
    Map<PrayerName, Integer> adjustments = new EnumMap<>(PrayerName.class);
    @Option(names = "--date", paramLabel = "<yyyy-mm-dd>",
            description = "The first day to print. Default: today in the display zone.")
    LocalDate date;
    @Option(names = "--days",
            defaultValue = "${env:DAYS:-1}",
            description = "The number of days to print. Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--zone",
            defaultValue = "${env:ZONE:-UTC}",
            description = "The time zone used for display, e.g. 'Europe/Vienna'. Default: ${DEFAULT-VALUE}")
    ZoneId zone;
    @Option(names = "--format",
            defaultValue = "${env:FORMAT:-TEXT}",
            description = "The output format. Valid values: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    OutputFormat format;
    @Option(names = "--sunnah",
            description = "Also print the middle and the last third of the night.")
    boolean sunnah;
    @Option(names = "--qibla",
            description = "Also print the qibla direction.")
    boolean qibla;
    @Option(names = "--next",
            description = "Also print the current and next prayer.")
    boolean next;

    private final Supplier<ZonedDateTime> currentTime;
    private final ObjectMapper mapper;

    public PrayerTimesCli() {
        this(ZonedDateTime::now);
    }

    public PrayerTimesCli(Supplier<ZonedDateTime> currentTime) {
        this.currentTime = currentTime;
        mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new PrayerTimesCli()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        try {
            assertConfigurationParameters();
            Coordinates coordinates = Coordinates.of(latitude, longitude);
            CalculationParameters parameters = createParameters();
            LOG.debug("Calculate prayer times for {}: {}", coordinates, parameters.toDebugString());
            PrayerTimesProvider provider = new PrayerTimesProviderImpl(coordinates, parameters, zone);
            LocalDate firstDay = date != null ? date : currentTime.get().withZoneSameInstant(zone).toLocalDate();
            if (format == OutputFormat.JSON) {
                printJson(coordinates, parameters, provider, firstDay);
            } else {
                printText(coordinates, parameters, provider, firstDay);
            }
        } finally {
            MDC.remove("context");
        }
    }

    private CalculationParameters createParameters() {
        CalculationParameters methodParameters = method.getParameters();
        PrayerAdjustments manualAdjustments = PrayerAdjustments.none();
        for (Map.Entry<PrayerName, Integer> entry : adjustments.entrySet()) {
            manualAdjustments = manualAdjustments.with(entry.getKey(), entry.getValue());
        }
        return methodParameters.toBuilder()
                               .madhab(madhab)
                               .highLatitudeRule(highLatitudeRule)
                               .shafaq(shafaq != null ? shafaq : methodParameters.getShafaq())
                               .rounding(rounding != null ? rounding : methodParameters.getRounding())
                               .adjustments(manualAdjustments)
                               .build();
    }

    private void printText(Coordinates coordinates, CalculationParameters parameters, PrayerTimesProvider provider,
                           LocalDate firstDay) {
        PrintWriter out = out();
        out.println("Prayer times for " + coordinates + " in " + zone + " (" + method.getDisplayName() + ", " +
                    parameters.getMadhab() + ")");
        if (qibla) {
            out.println("qibla: " + FormatUtil.formatDegrees(Qibla.of(coordinates).direction()));
        }
        for (int i = 0; i < days; i++) {
            LocalDate day = firstDay.plusDays(i);
            MDC.put("context", day.toString());
            out.println(day);
            Optional<PrayerSchedule> schedule = calculate(provider, day);
            if (schedule.isEmpty()) {
                continue;
            }
            for (Prayer prayer : schedule.get().getPrayers()) {
                out.println(String.format("  %-8s %s", prayer.name().getDisplayName(), formatTime(prayer)));
            }
            if (sunnah) {
                sunnahTimes(schedule.get()).ifPresent(sunnahTimes -> {
                    out.println("  middle of the night:     " + formatTime(sunnahTimes.middleOfTheNight()));
                    out.println("  last third of the night: " + formatTime(sunnahTimes.lastThirdOfTheNight()));
                });
            }
        }
        if (next) {
            MDC.put("context", "next");
            ZonedDateTime now = currentTime.get();
            calculate(provider, now.withZoneSameInstant(zone).toLocalDate()).ifPresent(schedule -> {
                out.println("current: " + schedule.currentPrayer(now.toInstant())
                                                  .map(prayer -> prayer.name().getDisplayName() + " " + formatTime(prayer))
                                                  .orElse("none"));
                Prayer nextPrayer = schedule.nextPrayer(now.toInstant());
                out.println("next: " + nextPrayer.name().getDisplayName() + " " + formatDateTime(nextPrayer));
            });
        }
        out.flush();
    }

    private void printJson(Coordinates coordinates, CalculationParameters parameters, PrayerTimesProvider provider,
                           LocalDate firstDay) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode location = root.putObject("coordinates");
        location.put("latitude", coordinates.latitude());
        location.put("longitude", coordinates.longitude());
        root.put("zone", zone.getId());
        root.put("method", method.name());
        root.put("madhab", parameters.getMadhab().name());
        if (qibla) {
            root.put("qibla", Qibla.of(coordinates).direction());
        }
        ArrayNode daysNode = root.putArray("days");
        for (int i = 0; i < days; i++) {
            LocalDate day = firstDay.plusDays(i);
            MDC.put("context", day.toString());
            ObjectNode dayNode = daysNode.addObject();
            dayNode.put("date", day.toString());
            try {
                PrayerSchedule schedule = provider.getSchedule(day);
                ObjectNode prayersNode = dayNode.putObject("prayers");
                for (Prayer prayer : schedule.getPrayers()) {
                    prayersNode.put(prayer.name().getDisplayName(), formatDateTime(prayer));
                }
                if (sunnah) {
                    sunnahTimes(schedule).ifPresent(sunnahTimes -> {
                        ObjectNode sunnahNode = dayNode.putObject("sunnah");
                        sunnahNode.put("middleOfTheNight", formatDateTime(sunnahTimes.middleOfTheNight()));
                        sunnahNode.put("lastThirdOfTheNight", formatDateTime(sunnahTimes.lastThirdOfTheNight()));
                    });
                }
            } catch (PrayerTimesException e) {
                LOG.warn("Prayer times not computable for {}: {}", day, e.getMessage());
                dayNode.put("error", e.getMessage());
            }
        }
        if (next) {
            MDC.put("context", "next");
            ZonedDateTime now = currentTime.get();
            try {
                PrayerSchedule schedule = provider.getSchedule(now.withZoneSameInstant(zone).toLocalDate());
                schedule.currentPrayer(now.toInstant())
                        .ifPresent(prayer -> root.put("current", prayer.name().getDisplayName()));
                Prayer nextPrayer = schedule.nextPrayer(now.toInstant());
                ObjectNode nextNode = root.putObject("next");
                nextNode.put("name", nextPrayer.name().getDisplayName());
                nextNode.put("time", formatDateTime(nextPrayer));
            } catch (PrayerTimesException e) {
                LOG.warn("Next prayer not computable: {}", e.getMessage());
            }
        }
        PrintWriter out = out();
        out.println(serialize(root));
        out.flush();
    }

    private Optional<PrayerSchedule> calculate(PrayerTimesProvider provider, LocalDate day) {
        try {
            return Optional.of(provider.getSchedule(day));
        } catch (PrayerTimesException e) {
            LOG.warn("Prayer times not computable for {}: {}", day, e.getMessage());
            out().println("  not computable: " + e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<SunnahTimes> sunnahTimes(PrayerSchedule schedule) {
        try {
            return Optional.of(SunnahTimes.from(schedule));
        } catch (PrayerTimesException e) {
            LOG.warn("Sunnah times not computable for {}: {}", schedule.getDay(), e.getMessage());
            return Optional.empty();
        }
    }

    private String serialize(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize prayer times", e);
        }
    }

    private String formatTime(Prayer prayer) {
        return formatTime(prayer.time());
    }

    private String formatTime(Instant instant) {
        return FormatUtil.formatTime(instant.atZone(zone));
    }

    private String formatDateTime(Prayer prayer) {
        return formatDateTime(prayer.time());
    }

    private String formatDateTime(Instant instant) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(zone));
    }

    private PrintWriter out() {
        return spec.commandLine().getOut();
    }

    private void assertConfigurationParameters() {
        if (latitude < -90 || latitude > 90) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude < -180 || longitude > 180) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (days < 1) {
            fail("--days must be >= 1");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}
