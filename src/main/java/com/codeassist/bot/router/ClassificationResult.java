package com.codeassist.bot.router;

import com.codeassist.bot.intent.Intent;
import com.codeassist.bot.language.Language;

public record ClassificationResult(Language language, Intent intent) {}
