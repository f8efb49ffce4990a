package hu.advjava.mcpcrossword;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Bundled puzzles, addressable as {@code crossword://examples/<name>}.
 */
public enum ExampleCrossword {
    TINY("Two crossing three-letter slots",
            List.of("___",
                    "##_",
                    "##_"),
            List.of("CAT", "DOG", "TIE")),
    SIMPLE("Five-by-five frame filled with number words",
            List.of("#___#",
                    "#_##_",
                    "#_##_",
                    "#_##_",
                    "#____"),
            List.of("ONE", "TWO", "THREE", "FOUR", "FIVE", "SIX", "SEVEN", "EIGHT", "NINE", "TEN")),
    STEPS("Staircase of short words",
            List.of("___##",
                    "_#___",
                    "___#_",
                    "##___"),
            Vocabulary.COMMON),
    ELL("Seven interlocking slots",
            List.of("____#",
                    "_##_#",
                    "_____",
                    "_#_#_",
                    "_#___"),
            Vocabulary.COMMON),
    LATTICE("Three-by-three lattice of five-letter words, no fill exists",
            List.of("_____",
                    "_#_#_",
                    "_____",
                    "_#_#_",
                    "_____"),
            Vocabulary.COMMON);

    private static final String URI_PREFIX = "crossword://examples/";

    private final String description;
    private final List<String> structure;
    private final List<String> words;

    private ExampleCrossword(String description, List<String> structure, List<String> words) {
        this.description = description;
        this.structure = structure;
        this.words = words;
    }

    public String getDescription() {
        return description;
    }
    public List<String> getStructure() {
        return structure;
    }
    public List<String> getWords() {
        return words;
    }

    public Crossword toCrossword() {
        return Crossword.parse(structure);
    }

    public String uri() {
        return URI_PREFIX + name().toLowerCase(Locale.ROOT);
    }

    // case-insensitive match on the name, with or without the URI prefix
    public static Optional<ExampleCrossword> find(String nameOrUri) {
        if (nameOrUri == null) return Optional.empty();
        String name = nameOrUri.startsWith(URI_PREFIX) ? nameOrUri.substring(URI_PREFIX.length()) : nameOrUri;
        return Arrays.stream(values()).filter(e -> e.name().equalsIgnoreCase(name)).findAny();
    }

    private static final class Vocabulary {
        static final List<String> COMMON = List.of((
                "ACE ACT ADD AGE AGO AID AIM AIR ALL AND ANT APE ARC ARE ARM ART ASH ASK ATE BAD BAG BAN BAT BED "
              + "BEE BET BIG BIT BOW BOX BUS CAN CAP CAR CAT COW CRY CUP CUT DAY DEN DIG DOG DOT DRY EAR EAT EGG "
              + "END ERA EVE EYE FAN FAR FAT FEW FIG FIT FLY FOR FOX FUN GAS GEM GET GUM HAT HEN HER HIT HOT ICE "
              + "INK JAR JOB KEY KID LAP LAW LEG LET LID LIE LOG LOT MAP MAT MEN MIX MUD NET NEW NOD NOT NOW NUT "
              + "OAK OAT ODD OFF OIL OLD ONE OWL OWN PAN PEN PET PIE PIG PIN POT RAT RED RIB ROD ROW RUG RUN SAD "
              + "SAT SAW SEA SET SIT SKY SUN TAN TAP TEA TEN TOE TON TOP TOY TUB USE VAN WAR WEB WET WIN YES ZOO "
              + "ABLE ACID AREA ARMY BAKE BALL BAND BANK BASE BEAR BEAT BELL BIRD BLUE BOAT BODY BONE BOOK CAKE "
              + "CALM CAMP CARD CARE CASE CELL CITY CLAY COAT CODE COLD CORN DARK DATA DATE DEAR DEER DESK DOOR "
              + "DOVE EASE EAST EDGE EVEN EXIT FACE FACT FARM FAST FEAR FILE FIRE FISH FLAG FOOD FOOT FORM GAME "
              + "GATE GIFT GOAL GOLD HAIR HALL HAND HEAT HERO HILL HOME IDEA IRON ITEM KING KITE LAKE LAND LANE "
              + "LEAF LINE LION LIST LOAD LOOP MAIL MEAL MILK MIND MOON NAME NEAR NEST NOTE OPEN OVEN PAGE PATH "
              + "PEAR PLAN RAIN RATE READ RING ROAD ROCK ROLE ROOF ROSE SAIL SALT SAND SEAT SEED SHIP SHOE SIDE "
              + "SNOW SOAP SONG STAR TALE TASK TEAM TIDE TIME TREE TRIP TUNE VASE VOTE WAVE WIND WOLF WOOD YARD "
              + "APPLE BEACH BREAD CHAIR CLOUD DANCE EAGLE EARTH FIELD GRAPE HEART HORSE HOUSE LEMON MONEY MUSIC "
              + "NIGHT OCEAN PAPER PEACH PIANO PLANT RIVER SHEEP SMILE SNAKE STONE STORM TABLE TIGER TOAST TRAIN "
              + "WATER WHALE ALERT ARENA AROSE ASIDE EATEN ENTER ERASE IDEAL OASIS OTTER RATES SNARE STEAL TENSE "
              + "TREAT").split(" "));
    }
}
