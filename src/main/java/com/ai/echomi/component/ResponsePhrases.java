package com.ai.echomi.component;

import com.ai.echomi.conversation.Language;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Everything the assistant says, in English and Hindi. Company names and digits
 * are passed in already formatted for speech.
 */
@Component
public class ResponsePhrases {

    private final String ownerName;

    public ResponsePhrases(@Value("${echomi.owner-name:Ruchit}") String ownerName) {
        this.ownerName = ownerName;
    }

    public String ownerName() {
        return ownerName;
    }

    private static String pick(Language lang, String en, String hi) {
        return lang == Language.HI ? hi : en;
    }

    // Delivery: opening

    public String deliveryFromCompany(Language lang, String company) {
        return pick(lang,
                "Hi! I see you have a delivery from " + company + ". Do you need help getting here, or are you already here?",
                "धन्यवाद! " + company + " की डिलीवरी के लिए मैं आपकी मदद कर सकता हूँ। क्या आप यहाँ हैं या आपको रास्ता चाहिए?");
    }

    public String askDeliveryCompany(Language lang) {
        return pick(lang,
                "Hi! I can help with your delivery. Which company is this delivery from?",
                "धन्यवाद! आपकी डिलीवरी के लिए मैं आपकी मदद कर सकता हूँ। यह किस कंपनी से है?");
    }

    public String greeting(Language lang) {
        return pick(lang, "Hello! How can I help you today?", "नमस्ते! मैं आपकी कैसे मदद कर सकता हूँ?");
    }

    public String askIfDelivery(Language lang) {
        return pick(lang,
                "Hello! Are you calling about a delivery?",
                "नमस्ते! क्या आप किसी डिलीवरी के बारे में कॉल कर रहे हैं?");
    }

    public String companyNoted(Language lang, String company) {
        return pick(lang,
                "Thank you! So you have a delivery from " + company + ". Do you need help getting here, or are you already here?",
                "धन्यवाद! तो आपके पास " + company + " से डिलीवरी है। क्या आपको यहाँ आने में मदद चाहिए या आप पहले से यहाँ हैं?");
    }

    // Delivery: directions

    public String askCurrentLocation(Language lang) {
        return pick(lang,
                "I'd be happy to help guide you here. What's your current location or a nearby landmark?",
                "मैं आपकी यहाँ पहुँचने में मदद करूंगा। आपकी वर्तमान स्थिति या कोई पास का लैंडमार्क बताएं?");
    }

    public String clarifyLocationHelp(Language lang) {
        return pick(lang,
                "Are you asking for directions to get here, or have you already arrived at the location?",
                "क्या आप यहाँ आने के लिए दिशा-निर्देश चाहते हैं या आप पहले से ही यहाँ पहुँच गए हैं?");
    }

    public String directions(Language lang, String place, String steps, int etaMinutes) {
        return pick(lang,
                "I found your location: " + place + ". Here are the directions: " + steps
                        + ". You should reach in about " + etaMinutes + " minutes. Let me know when you arrive!",
                "मुझे आपकी लोकेशन मिल गई: " + place + "। रास्ता: " + steps
                        + "। आप लगभग " + etaMinutes + " मिनट में पहुँच जाएंगे। पहुँचने पर मुझे बताएं!");
    }

    public String locationWithoutDirections(Language lang, String place) {
        return pick(lang,
                "I found your location: " + place + ", but I couldn't get detailed directions. Please use your GPS to navigate to the delivery address. Let me know when you arrive!",
                "मुझे आपकी लोकेशन मिल गई: " + place + ", लेकिन पूरा रास्ता नहीं मिल पाया। कृपया GPS से डिलीवरी पते पर पहुँचें और पहुँचने पर मुझे बताएं!");
    }

    public String locationNotFound(Language lang) {
        return pick(lang,
                "I couldn't find that location. Could you try a more specific address or nearby landmark?",
                "मुझे वह जगह नहीं मिली। क्या आप कोई सटीक पता या पास का लैंडमार्क बता सकते हैं?");
    }

    public String navigateManually(Language lang) {
        return pick(lang,
                "I'm still not able to find that spot. Please use your GPS to navigate to the delivery address, and let me know when you arrive!",
                "मुझे अभी भी वह जगह नहीं मिल रही। कृपया GPS से डिलीवरी पते पर पहुँचें और पहुँचने पर मुझे बताएं!");
    }

    public String askLandmarks(Language lang) {
        return pick(lang,
                "What landmarks can you see around you? I can help guide you from there.",
                "आपके आसपास कौन से लैंडमार्क दिख रहे हैं? मैं वहाँ से आपको रास्ता बता सकता हूँ।");
    }

    public String waitForArrival(Language lang) {
        return pick(lang, "Let me know when you reach the location!", "पहुँचने पर मुझे बताएं!");
    }

    // Delivery: arrival and OTP

    public String askCompanyOnArrival(Language lang) {
        return pick(lang,
                "Great! You're here. Which company is this delivery from?",
                "बहुत अच्छा! आप यहाँ हैं। यह किस कंपनी की डिलीवरी है?");
    }

    public String arrivedAskOtp(Language lang, String company) {
        return pick(lang,
                "Perfect! You've arrived with the " + company + " delivery. Do you need the OTP?",
                "बहुत अच्छा! आप " + company + " डिलीवरी के साथ यहाँ पहुँच गए हैं। क्या आपको OTP चाहिए?");
    }

    public String clarifyOtpNeeded(Language lang) {
        return pick(lang,
                "Do you need me to provide the OTP for this delivery? Please say yes or no.",
                "क्या आपको इस डिलीवरी के लिए OTP चाहिए? कृपया हाँ या ना कहें।");
    }

    public String noOtpGoodbye(Language lang) {
        return pick(lang, "Alright! Have a great day and safe delivery!", "ठीक है! आपका दिन शुभ हो और सुरक्षित डिलीवरी करें!");
    }

    public String checkingMessages(Language lang, String company) {
        return pick(lang,
                "I'll check your recent messages for the " + company + " OTP. Please give me a moment.",
                "मैं आपके हाल के संदेशों में " + company + " का OTP खोज रहा हूँ। कृपया एक क्षण प्रतीक्षा करें।");
    }

    public String lookingForCompanyOtp(Language lang, String company) {
        return pick(lang,
                "Thank you! Now I'll look for the " + company + " OTP.",
                "धन्यवाद! अब मैं " + company + " का OTP खोज रहा हूँ।");
    }

    public String askOtpCompany(Language lang) {
        return pick(lang, "Which company is this OTP request for?", "आपको किस कंपनी का OTP चाहिए?");
    }

    public String otpFoundConfident(Language lang, String company, String spacedOtp) {
        return pick(lang,
                "I found your " + company + " OTP! It's " + spacedOtp + ". Thank you and have a safe delivery!",
                "मुझे आपका " + company + " OTP मिल गया! यह " + spacedOtp + " है। धन्यवाद और सुरक्षित डिलीवरी करें!");
    }

    public String otpFoundVerify(Language lang, String company, String sender, String spacedOtp) {
        return pick(lang,
                "I found an OTP from " + sender + ": " + spacedOtp + ". Please verify this is for " + company + ". Thank you!",
                "मुझे " + sender + " से एक OTP मिला: " + spacedOtp + "। कृपया जाँच लें कि यह " + company + " के लिए है। धन्यवाद!");
    }

    public String otpFoundWithoutCompanyMatch(Language lang, String company, String sender, String spacedOtp) {
        return pick(lang,
                "I couldn't find an exact " + company + " match, but I found an OTP from " + sender + ": " + spacedOtp + ". Please check that this is the right OTP.",
                "मुझे " + company + " का सटीक मैच नहीं मिला, लेकिन " + sender + " का OTP मिला: " + spacedOtp + "। कृपया जाँच लें कि यह सही OTP है।");
    }

    public String trackingSuffix(Language lang, String trackingId) {
        return pick(lang, " Tracking ID: " + trackingId, " ट्रैकिंग आईडी: " + trackingId);
    }

    public String noRecentSms(Language lang) {
        return pick(lang,
                "I don't see any recent SMS messages. Could you tell me the OTP manually?",
                "मुझे आपके हाल के संदेशों में कोई SMS नहीं मिला। क्या आप OTP बता सकते हैं?");
    }

    public String otpNotInMessages(Language lang, int checked, String company) {
        return pick(lang,
                "I checked " + checked + " messages but couldn't find a " + company + " OTP. Could you tell me the OTP manually?",
                "मैंने " + checked + " संदेश देखे लेकिन " + company + " का कोई OTP नहीं मिला। क्या आप मैन्युअल रूप से OTP बता सकते हैं?");
    }

    public String confirmManualOtp(Language lang, String company, String spacedOtp) {
        return pick(lang,
                "Thank you! Your OTP for " + company + " is " + spacedOtp + ". Is this correct?",
                "धन्यवाद! " + company + " के लिए आपका OTP " + spacedOtp + " है। क्या यह सही है?");
    }

    public String manualOtpNotUnderstood(Language lang) {
        return pick(lang,
                "I couldn't understand the OTP. Please tell me just the 4 or 6 digit numbers.",
                "मुझे OTP नंबर समझ नहीं आया। कृपया केवल 4 या 6 अंकों का OTP बताएं।");
    }

    public String manualOtpConfirmed(Language lang, String company, String spacedOtp) {
        return pick(lang,
                "Perfect! Your " + company + " OTP " + spacedOtp + " is confirmed. Need any other help?",
                "बहुत अच्छे! " + company + " का OTP " + spacedOtp + " सुरक्षित है। कुछ और मदद चाहिए?");
    }

    public String askCorrectOtp(Language lang) {
        return pick(lang, "No problem. Please tell me the correct OTP.", "कोई बात नहीं। कृपया सही OTP बताएं।");
    }

    public String deliveryWelcomeGoodbye(Language lang) {
        return pick(lang, "You're welcome! Have a safe delivery!", "आपका स्वागत है! सुरक्षित डिलीवरी करें!");
    }

    public String deliveryFallback(Language lang) {
        return pick(lang,
                "I'm here to help with your delivery. What can I assist you with?",
                "मैं आपकी डिलीवरी में मदद के लिए यहाँ हूँ। मैं क्या कर सकता हूँ?");
    }

    // Unknown callers

    public String askName(Language lang) {
        return pick(lang, "May I know who's calling?", "कृपया बताएं आप कौन हैं?");
    }

    public String askPurpose(Language lang, String name) {
        return pick(lang,
                "Hi " + name + "! And what is the reason for your call?",
                "नमस्ते " + name + "! आज आपके कॉल का क्या उद्देश्य है?");
    }

    public String askSpellName(Language lang) {
        return pick(lang,
                "I'm sorry, I didn't catch your name. Could you please spell it out?",
                "माफ़ कीजिए, मैं आपका नाम समझ नहीं पाया। क्या आप इसे स्पेल कर सकते हैं?");
    }

    public String askPurposeWithoutName(Language lang) {
        return pick(lang,
                "No worries. What is the reason for your call?",
                "कोई बात नहीं। आपके कॉल का क्या उद्देश्य है?");
    }

    public String urgentAcknowledged(Language lang) {
        return pick(lang,
                "Okay, I understand this is urgent. I am notifying " + ownerName + " immediately.",
                "यह जरूरी लग रहा है। मैं तुरंत " + ownerName + " को सूचित करूंगा।");
    }

    public String unknownCallerName(Language lang) {
        return pick(lang, "An unknown caller", "एक अज्ञात कॉलर");
    }

    public String askCallbackNumber(Language lang) {
        return pick(lang,
                "Got it. What's the best number for " + ownerName + " to call you back on?",
                "ठीक है। " + ownerName + " आपको किस नंबर पर वापस कॉल करें?");
    }

    public String askCallbackNumberAfterDetails(Language lang) {
        return pick(lang,
                "Thank you for those details. What's the best number for " + ownerName + " to call you back on?",
                "जानकारी के लिए धन्यवाद। " + ownerName + " आपको किस नंबर पर वापस कॉल करें?");
    }

    public String askCallbackNumberAfterAllDetails(Language lang) {
        return pick(lang,
                "Excellent, thank you for all that information. What's the best number for " + ownerName + " to call you back on?",
                "सारी जानकारी के लिए धन्यवाद। " + ownerName + " आपको किस नंबर पर वापस कॉल करें?");
    }

    public String numberConfirmed(Language lang, String spacedNumber) {
        return pick(lang,
                "Perfect, I have your number as " + spacedNumber + ". I'll make sure " + ownerName + " gets all this information and calls you back. Have a great day!",
                "बहुत अच्छा, आपका नंबर " + spacedNumber + " है। मैं " + ownerName + " को यह सारी जानकारी दे दूँगा और वे आपको वापस कॉल करेंगे। आपका दिन शुभ हो!");
    }

    public String selfNumberNoted(Language lang) {
        return pick(lang,
                "Okay, noted. " + ownerName + " will call you back on the number you are calling from. Thank you!",
                "ठीक है। " + ownerName + " आपको इसी नंबर पर वापस कॉल करेंगे। धन्यवाद!");
    }

    public String askNumberAgain(Language lang) {
        return pick(lang,
                "I didn't quite catch that. Could you please provide a callback number?",
                "मैं समझ नहीं पाया। कृपया कॉलबैक नंबर बताएं?");
    }

    public String unknownCallerGoodbye(Language lang) {
        return pick(lang,
                "Thank you for calling. I'll make sure " + ownerName + " gets your message. Have a great day!",
                "कॉल करने के लिए धन्यवाद। मैं " + ownerName + " को आपका संदेश दे दूँगा। आपका दिन शुभ हो!");
    }
}
